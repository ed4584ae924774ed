package com.authbridge.credentials;

/**
 * States a credential request moves through inside {@link CredentialIssuer}.
 */
public enum IssuanceState {

    /** No entry for the username in the cache. */
    NO_CACHE_ENTRY,

    /** A live entry was found and served. */
    CACHE_VALID,

    /** An entry exists but its TTL has run out. */
    CACHE_EXPIRED,

    /** A new password was generated, upserted and cached. */
    ISSUED,

    /** Issuance failed; nothing was cached. */
    FAILED
}
