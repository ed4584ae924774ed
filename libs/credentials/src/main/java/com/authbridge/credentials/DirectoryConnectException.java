package com.authbridge.credentials;

/**
 * Thrown when the remote directory cannot be reached: connection refused, TLS failure,
 * or a connect/read timeout.
 */
public class DirectoryConnectException extends RuntimeException {

    public DirectoryConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
