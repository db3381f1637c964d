package com.visualoom.service.embedding;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Maps text and images into a shared vector space of fixed dimension.
 *
 * Implementations may return empty or throw when a vector cannot be produced;
 * callers treat both as "no embedding".
 */
public interface EmbeddingModel {

    Optional<float[]> textEmbedding(String text);

    Optional<float[]> imageEmbedding(Path imagePath);
}
