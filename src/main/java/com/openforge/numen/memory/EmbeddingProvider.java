package com.openforge.numen.memory;

import com.openforge.numen.error.ProviderException;

/**
 * Fixed-dimension text embeddings.
 */
public interface EmbeddingProvider {

    /**
     * @throws ProviderException when the provider fails or times out
     */
    float[] embed(String text);
}
