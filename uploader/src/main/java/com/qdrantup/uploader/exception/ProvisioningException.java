package com.qdrantup.uploader.exception;

/**
 * The collection existence check or the collection creation call failed.
 */
public class ProvisioningException extends UploadException {

    public ProvisioningException(String message, Throwable cause) {
        super(Stage.PROVISION, message, cause);
    }
}
