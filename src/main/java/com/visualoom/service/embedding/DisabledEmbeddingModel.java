package com.visualoom.service.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Placeholder used when no embedding model is configured. Images are still
 * catalogued and tag search keeps working; semantic search returns nothing.
 */
public class DisabledEmbeddingModel implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(DisabledEmbeddingModel.class);

    private final AtomicBoolean warned = new AtomicBoolean(false);

    @Override
    public Optional<float[]> textEmbedding(String text) {
        warnOnce();
        return Optional.empty();
    }

    @Override
    public Optional<float[]> imageEmbedding(Path imagePath) {
        warnOnce();
        return Optional.empty();
    }

    private void warnOnce() {
        if (warned.compareAndSet(false, true)) {
            log.warn("No embedding model configured: images are indexed without vectors");
        }
    }
}
