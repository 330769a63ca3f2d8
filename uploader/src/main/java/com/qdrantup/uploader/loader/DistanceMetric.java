package com.qdrantup.uploader.loader;

/**
 * Similarity metric of a collection's vectors.
 */
public enum DistanceMetric {
    COSINE
}
