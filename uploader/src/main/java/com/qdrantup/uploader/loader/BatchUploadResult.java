package com.qdrantup.uploader.loader;

/**
 * Counts for a completed batch upload.
 */
public record BatchUploadResult(
        int totalBatches,
        int totalPoints
) {}
