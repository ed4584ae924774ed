package com.authbridge.credentials;

/**
 * Base class for failures of {@link CredentialCipher}.
 */
public class CipherException extends RuntimeException {

    public CipherException(String message) {
        super(message);
    }

    public CipherException(String message, Throwable cause) {
        super(message, cause);
    }
}
