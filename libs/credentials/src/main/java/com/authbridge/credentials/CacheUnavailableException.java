package com.authbridge.credentials;

/**
 * Thrown by {@link CacheStore} implementations when the backing store cannot be reached
 * or answers with an error.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
