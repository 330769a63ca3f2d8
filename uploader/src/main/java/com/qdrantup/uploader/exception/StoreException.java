package com.qdrantup.uploader.exception;

/**
 * Raised by a {@code VectorStore} when a remote call fails, times out, or is interrupted.
 * Callers translate it into the exception for their own stage.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
