package com.qdrantup.uploader.exception;

/**
 * The configured endpoint is not a URL a gRPC port can be applied to.
 */
public class InvalidEndpointException extends UploadException {

    public InvalidEndpointException(String message) {
        super(Stage.ENDPOINT, message);
    }

    public InvalidEndpointException(String message, Throwable cause) {
        super(Stage.ENDPOINT, message, cause);
    }
}
