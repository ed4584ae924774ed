package com.authbridge.bridge.infrastructure.directory;

import com.authbridge.credentials.DirectoryAuthenticationException;
import com.authbridge.credentials.DirectoryClient;
import com.authbridge.credentials.DirectoryUser;
import com.authbridge.credentials.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the directory's credential check once, on first use, before delegating writes.
 *
 * <p>WHY: The bridge must start even while the cluster is still coming up. The check is
 * deferred to the first upsert and guarded so that concurrent first requests run it exactly
 * once. A failed check is not remembered; the next request tries again.
 *
 * <p>Refused management credentials are reported as a {@link UpsertResult.Rejected} carrying the
 * directory's status, so the issuer treats them like any other refused write.
 */
public class VerifiedDirectoryClient implements DirectoryClient {

    private static final Logger log = LoggerFactory.getLogger(VerifiedDirectoryClient.class);

    private final DirectoryClient delegate;
    private final Object initLock = new Object();
    private volatile boolean verified;

    public VerifiedDirectoryClient(DirectoryClient delegate) {
        this.delegate = delegate;
    }

    @Override
    public void authenticate() {
        if (verified) {
            return;
        }
        synchronized (initLock) {
            if (!verified) {
                delegate.authenticate();
                verified = true;
            }
        }
    }

    @Override
    public UpsertResult upsertUser(DirectoryUser user) {
        try {
            authenticate();
        } catch (DirectoryAuthenticationException e) {
            log.warn("Directory credential check failed: status={}", e.status());
            return UpsertResult.rejected(e.status(), e.getMessage());
        }
        return delegate.upsertUser(user);
    }

    /** Whether the credential check has succeeded. */
    public boolean isVerified() {
        return verified;
    }
}
