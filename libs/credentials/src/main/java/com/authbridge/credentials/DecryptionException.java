package com.authbridge.credentials;

/**
 * Thrown when a cached blob cannot be turned back into a password: corrupt entry,
 * truncated data or a secret key that differs from the one used to encrypt it.
 */
public class DecryptionException extends CipherException {

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
