package com.authbridge.credentials.testing;

import com.authbridge.credentials.DirectoryClient;
import com.authbridge.credentials.DirectoryConnectException;
import com.authbridge.credentials.DirectoryUser;
import com.authbridge.credentials.UpsertResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A {@link DirectoryClient} that keeps users in memory and records every call.
 * <p>
 * Answers {@code Created} for new usernames and {@code Updated} afterwards, unless a
 * rejection or an outage has been scripted. Placed in {@code src/main/java} for
 * cross-module test use.
 */
public final class RecordingDirectoryClient implements DirectoryClient {

    private final Map<String, DirectoryUser> users = new ConcurrentHashMap<>();
    private final List<DirectoryUser> upserts = new ArrayList<>();
    private final AtomicInteger authenticateCount = new AtomicInteger();
    private final AtomicReference<UpsertResult.Rejected> rejection = new AtomicReference<>();
    private final AtomicReference<String> outage = new AtomicReference<>();

    @Override
    public void authenticate() {
        authenticateCount.incrementAndGet();
        String reason = outage.get();
        if (reason != null) {
            throw new DirectoryConnectException(reason, null);
        }
    }

    @Override
    public synchronized UpsertResult upsertUser(DirectoryUser user) {
        upserts.add(user);
        String reason = outage.get();
        if (reason != null) {
            throw new DirectoryConnectException(reason, null);
        }
        UpsertResult.Rejected rejected = rejection.get();
        if (rejected != null) {
            return rejected;
        }
        DirectoryUser previous = users.put(user.username(), user);
        return previous == null ? new UpsertResult.Created() : new UpsertResult.Updated();
    }

    /** Scripts every following upsert to be rejected with the given status. */
    public RecordingDirectoryClient rejectWith(int status, String body) {
        rejection.set(new UpsertResult.Rejected(status, body));
        return this;
    }

    /** Scripts every following call to fail as unreachable. */
    public RecordingDirectoryClient failWith(String reason) {
        outage.set(reason);
        return this;
    }

    /** Clears scripted failures. */
    public RecordingDirectoryClient recover() {
        rejection.set(null);
        outage.set(null);
        return this;
    }

    /** Every upsert attempted so far, in call order. */
    public synchronized List<DirectoryUser> upserts() {
        return List.copyOf(upserts);
    }

    /** Number of upserts attempted so far. */
    public synchronized int upsertCount() {
        return upserts.size();
    }

    /** Last successfully stored record for the username, if any. */
    public DirectoryUser user(String username) {
        return users.get(username);
    }

    public int authenticateCount() {
        return authenticateCount.get();
    }
}
