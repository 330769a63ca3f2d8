package com.qdrantup.uploader.progress;

/**
 * Receives structured progress for an upload run, in batch order.
 */
public interface ProgressListener {

    void onBatchUploaded(ProgressEvent event);

    /**
     * Called only when every batch succeeded. Never called after a failure.
     */
    void onComplete(CompletionEvent event);
}
