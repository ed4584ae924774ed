package com.authbridge.credentials;

/**
 * Thrown when the directory rejects the bridge's management credentials.
 */
public class DirectoryAuthenticationException extends RuntimeException {

    private final int status;

    public DirectoryAuthenticationException(int status, String message) {
        super(message);
        this.status = status;
    }

    /** HTTP status returned by the directory. */
    public int status() {
        return status;
    }
}
