package com.qdrantup.uploader.exception;

/**
 * The input file was read but is not well-formed JSON, or does not have the
 * {@code {"points": [...]}} shape.
 */
public class InputParseException extends UploadException {

    public InputParseException(String message) {
        super(Stage.PARSE, message);
    }

    public InputParseException(String message, Throwable cause) {
        super(Stage.PARSE, message, cause);
    }
}
