package com.openforge.numen.memory;

import java.util.List;

/**
 * Response of POST /embeddings; only the first vector is used.
 */
public record EmbeddingResponse(String object, List<EmbeddingData> data, String model) {

    public List<Float> firstEmbedding() {
        if (data == null || data.isEmpty() || data.get(0).embedding() == null) {
            throw new IllegalStateException("Embedding response contained no data");
        }
        return data.get(0).embedding();
    }

    public record EmbeddingData(String object, int index, List<Float> embedding) {}
}
