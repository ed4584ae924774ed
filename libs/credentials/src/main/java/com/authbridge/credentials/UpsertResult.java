package com.authbridge.credentials;

/**
 * Outcome of {@link DirectoryClient#upsertUser(DirectoryUser)}.
 * <p>
 * The directory answering is not an exception: a rejected write is a normal result the
 * caller must inspect. Only failing to reach the directory at all is thrown
 * ({@link DirectoryConnectException}).
 */
public sealed interface UpsertResult
        permits UpsertResult.Created, UpsertResult.Updated, UpsertResult.Rejected {

    /** Whether the directory now holds the submitted record. */
    boolean succeeded();

    /** The user did not exist and was created. */
    record Created() implements UpsertResult {
        @Override
        public boolean succeeded() {
            return true;
        }
    }

    /** The user existed and was overwritten. */
    record Updated() implements UpsertResult {
        @Override
        public boolean succeeded() {
            return true;
        }
    }

    /**
     * The directory refused the write.
     *
     * @param status HTTP status returned by the directory
     * @param body   response body, for diagnostics
     */
    record Rejected(int status, String body) implements UpsertResult {
        @Override
        public boolean succeeded() {
            return false;
        }
    }

    static UpsertResult created() {
        return new Created();
    }

    static UpsertResult updated() {
        return new Updated();
    }

    static UpsertResult rejected(int status, String body) {
        return new Rejected(status, body);
    }
}
