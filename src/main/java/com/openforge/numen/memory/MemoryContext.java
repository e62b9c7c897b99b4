package com.openforge.numen.memory;

import com.openforge.numen.domain.ThreadMessage;

import java.util.List;
import java.util.Locale;

/**
 * What an agent knows going into a turn.
 *
 * @param retrieved  long-term memories, best first
 * @param recent     the thread's latest turns, oldest first
 * @param confidence mean similarity of {@code retrieved}, 0 when nothing was retrieved
 */
public record MemoryContext(
        List<MemoryRecord> retrieved,
        List<ThreadMessage> recent,
        double confidence
) {

    public MemoryContext {
        retrieved = retrieved == null ? List.of() : List.copyOf(retrieved);
        recent = recent == null ? List.of() : List.copyOf(recent);
    }

    public static MemoryContext empty() {
        return new MemoryContext(List.of(), List.of(), 0.0);
    }

    /** Prompt block for the retrieved memories; null when there are none. */
    public String formatForPrompt() {
        if (retrieved.isEmpty()) return null;
        StringBuilder sb = new StringBuilder("## Relevant memories from past conversations:\n");
        for (MemoryRecord m : retrieved) {
            sb.append(String.format(Locale.ROOT, "- [%s] %s (relevance: %.2f)\n",
                    m.memoryType(), m.content(), m.similarity()));
        }
        return sb.toString();
    }
}
