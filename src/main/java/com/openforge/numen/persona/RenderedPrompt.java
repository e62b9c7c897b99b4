package com.openforge.numen.persona;

import java.util.List;

/**
 * Output of {@link TraitModulator#render}: the full system prompt and the
 * per-trait directives it was assembled from, in trait declaration order.
 */
public record RenderedPrompt(String systemPrompt, List<Directive> directives) {

    public RenderedPrompt {
        directives = List.copyOf(directives);
    }
}
