package com.qdrantup.uploader.orchestrator;

import com.qdrantup.uploader.loader.CollectionProvisioner;

/**
 * Outcome of a successful upload run.
 */
public record UploadSummary(
        String collection,
        CollectionProvisioner.Outcome collectionOutcome,
        int totalBatches,
        int totalPoints,
        long durationMs
) {

    public boolean collectionCreated() {
        return collectionOutcome == CollectionProvisioner.Outcome.CREATED;
    }
}
