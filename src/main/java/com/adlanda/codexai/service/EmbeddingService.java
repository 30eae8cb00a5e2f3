package com.adlanda.codexai.service;

import com.adlanda.codexai.exception.IndexBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service responsible for generating vector embeddings from text.
 *
 * Uses Spring AI's EmbeddingModel. Any provider fault surfaces as {@link IndexBackendException}.
 */
@Service
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingModel embeddingModel;

    public EmbeddingService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    /**
     * Generates an embedding vector for the given text.
     *
     * @param text The text to embed
     * @return A list of doubles representing the embedding vector
     */
    public List<Double> embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    /**
     * Embeds several texts in one provider call, preserving order.
     */
    public List<List<Double>> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        EmbeddingResponse response;
        try {
            response = embeddingModel.embedForResponse(texts);
        } catch (RuntimeException e) {
            throw new IndexBackendException("Embedding request failed: " + e.getMessage(), e);
        }
        if (response == null || response.getResults().size() != texts.size()) {
            throw new IndexBackendException("Embedding provider returned "
                    + (response == null ? 0 : response.getResults().size()) + " vectors for " + texts.size() + " texts");
        }
        log.debug("Generated {} embeddings", texts.size());
        return response.getResults().stream()
                .map(embedding -> toDoubleList(embedding.getOutput()))
                .toList();
    }

    private List<Double> toDoubleList(float[] floats) {
        Double[] doubles = new Double[floats.length];
        for (int i = 0; i < floats.length; i++) {
            doubles[i] = (double) floats[i];
        }
        return List.of(doubles);
    }
}
