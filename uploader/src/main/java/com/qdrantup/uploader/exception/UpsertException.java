package com.qdrantup.uploader.exception;

/**
 * A single batch could not be written. Batches after it were never attempted.
 */
public class UpsertException extends UploadException {

    private final int batchIndex;

    public UpsertException(int batchIndex, int totalBatches, Throwable cause) {
        super(Stage.UPSERT, "Failed to upsert batch " + batchIndex + " of " + totalBatches, cause);
        this.batchIndex = batchIndex;
    }

    /**
     * @return the 1-based index of the batch that failed
     */
    public int getBatchIndex() {
        return batchIndex;
    }
}
