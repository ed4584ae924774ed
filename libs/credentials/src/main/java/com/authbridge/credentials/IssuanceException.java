package com.authbridge.credentials;

/**
 * Single failure type of {@link CredentialIssuer#issue(Identity)}.
 * <p>
 * When this is thrown no cache entry has been written; an entry that existed before the
 * request is left as it was.
 */
public class IssuanceException extends RuntimeException {

    /**
     * What went wrong.
     */
    public enum Kind {
        DIRECTORY_UNAVAILABLE,
        DIRECTORY_REJECTED,
        ENCRYPTION_FAILED,
        DECRYPTION_FAILED,
        CACHE_UNAVAILABLE,
        LOCK_TIMEOUT
    }

    private final Kind kind;
    private final String username;

    public IssuanceException(Kind kind, String username, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.username = username;
    }

    public IssuanceException(Kind kind, String username, String message) {
        this(kind, username, message, null);
    }

    public Kind kind() {
        return kind;
    }

    public String username() {
        return username;
    }

    /** Always {@link IssuanceState#FAILED}. */
    public IssuanceState state() {
        return IssuanceState.FAILED;
    }
}
