package com.qdrantup.uploader.exception;

/**
 * The Qdrant client could not be built from the resolved configuration.
 */
public class ConnectionException extends UploadException {

    public ConnectionException(String message, Throwable cause) {
        super(Stage.CONNECT, message, cause);
    }
}
