package com.authbridge.credentials;

/**
 * Thrown when a password cannot be encrypted for storage.
 */
public class EncryptionException extends CipherException {

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
