package com.qdrantup.uploader.exception;

/**
 * Base type for every failure that aborts an upload run. Each subclass is bound
 * to the pipeline stage that raised it so the caller can report where the run stopped.
 */
public abstract class UploadException extends Exception {

    /**
     * Pipeline stages, in execution order.
     */
    public enum Stage {
        LOAD,
        PARSE,
        ENDPOINT,
        CONNECT,
        PROVISION,
        UPSERT
    }

    private final Stage stage;

    protected UploadException(Stage stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected UploadException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
