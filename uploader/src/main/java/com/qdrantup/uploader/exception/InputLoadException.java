package com.qdrantup.uploader.exception;

/**
 * The input file could not be read.
 */
public class InputLoadException extends UploadException {

    public InputLoadException(String message, Throwable cause) {
        super(Stage.LOAD, message, cause);
    }
}
