package com.authbridge.credentials;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Serves a cached password for an identity, or issues a new one.
 * <p>
 * Per request, keyed by username:
 * <ol>
 *   <li>a live cache entry ({@link IssuanceState#CACHE_VALID}) is decrypted and returned; with
 *       TTL extension enabled its expiry slides back to the full TTL. The directory is not
 *       contacted.</li>
 *   <li>otherwise ({@link IssuanceState#NO_CACHE_ENTRY} / {@link IssuanceState#CACHE_EXPIRED})
 *       a password is generated, encrypted, upserted to the directory and cached
 *       ({@link IssuanceState#ISSUED}).</li>
 * </ol>
 * The cache is written only after the directory accepted the user, so a live entry always
 * holds the password the directory last received. Concurrent issuances for the same username
 * are serialized through an advisory lock in the cache store; a request that loses the race
 * waits for the winner's entry instead of issuing a second password.
 * <p>
 * Every failure is reported as {@link IssuanceException}. Nothing is retried here.
 */
public final class CredentialIssuer {

    private static final Logger log = LoggerFactory.getLogger(CredentialIssuer.class);

    private final CacheStore cacheStore;
    private final DirectoryClient directoryClient;
    private final CredentialCipher cipher;
    private final PasswordSource passwordSource;
    private final GroupRoleConfig roleConfig;
    private final IssuerSettings settings;
    private final Clock clock;

    public CredentialIssuer(
            CacheStore cacheStore,
            DirectoryClient directoryClient,
            CredentialCipher cipher,
            PasswordSource passwordSource,
            GroupRoleConfig roleConfig,
            IssuerSettings settings,
            Clock clock) {
        this.cacheStore = cacheStore;
        this.directoryClient = directoryClient;
        this.cipher = cipher;
        this.passwordSource = passwordSource;
        this.roleConfig = roleConfig;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Returns the password for {@code identity} using the role table this issuer was built with.
     *
     * @throws IssuanceException if the credential can be neither served nor issued
     */
    public IssuedCredential issue(Identity identity) {
        return issue(identity, roleConfig);
    }

    /**
     * Returns the password for {@code identity}, mapping roles with {@code roles} if a new
     * password has to be issued.
     *
     * @throws IssuanceException if the credential can be neither served nor issued
     */
    public IssuedCredential issue(Identity identity, GroupRoleConfig roles) {
        String username = identity.username();
        String cacheKey = cacheKey(username);

        Optional<IssuedCredential> cached = lookup(username, cacheKey);
        if (cached.isPresent()) {
            return cached.get();
        }
        if (!settings.lockEnabled()) {
            return regenerate(identity, roles, cacheKey);
        }

        String lockKey = CacheKeys.lockKey(settings.cacheKeyPrefix(), username);
        String token = UUID.randomUUID().toString();
        Instant deadline = clock.instant().plus(settings.lockWait());

        while (!acquire(username, lockKey, token)) {
            if (!clock.instant().isBefore(deadline)) {
                throw new IssuanceException(IssuanceException.Kind.LOCK_TIMEOUT, username,
                        "Timed out waiting for a concurrent issuance for user " + username);
            }
            pause(username);
            cached = lookup(username, cacheKey);
            if (cached.isPresent()) {
                log.debug("Served credential issued by a concurrent request");
                return cached.get();
            }
        }

        try {
            // A concurrent request may have finished between our miss and taking the lock.
            cached = lookup(username, cacheKey);
            if (cached.isPresent()) {
                return cached.get();
            }
            return regenerate(identity, roles, cacheKey);
        } finally {
            release(lockKey, token);
        }
    }

    /**
     * Cache key for a username under this issuer's prefix.
     */
    public String cacheKey(String username) {
        return CacheKeys.credentialKey(settings.cacheKeyPrefix(), username);
    }

    private Optional<IssuedCredential> lookup(String username, String cacheKey) {
        try {
            if (!cacheStore.exists(cacheKey)) {
                log.debug("Cache miss: key={} state={}", cacheKey, IssuanceState.NO_CACHE_ENTRY);
                return Optional.empty();
            }
            Duration remaining = cacheStore.ttl(cacheKey);
            if (remaining.isZero() || remaining.isNegative()) {
                log.debug("Cache miss: key={} state={}", cacheKey, IssuanceState.CACHE_EXPIRED);
                return Optional.empty();
            }
            Optional<String> encrypted = cacheStore.get(cacheKey);
            if (encrypted.isEmpty()) {
                // expired between the TTL check and the read
                log.debug("Cache miss: key={} state={}", cacheKey, IssuanceState.CACHE_EXPIRED);
                return Optional.empty();
            }

            String password = decrypt(username, encrypted.get());

            boolean extended = false;
            if (settings.extendTtl() && remaining.compareTo(settings.ttl()) < 0) {
                cacheStore.refreshExpiry(cacheKey, settings.ttl());
                extended = true;
                log.debug("Extended cache TTL: key={} from={}s to={}s",
                        cacheKey, remaining.toSeconds(), settings.ttl().toSeconds());
            }
            log.debug("Cache hit: key={} remaining={}s", cacheKey, remaining.toSeconds());
            return Optional.of(new IssuedCredential(username, password, IssuanceState.CACHE_VALID, extended));
        } catch (CacheUnavailableException e) {
            throw cacheFailure(username, e);
        }
    }

    private IssuedCredential regenerate(Identity identity, GroupRoleConfig roles, String cacheKey) {
        String username = identity.username();
        Instant started = clock.instant();

        String password = passwordSource.next();
        List<String> assigned = RoleMapper.mapRoles(identity.groups(), roles);

        // Encrypt before the remote write so a cipher failure leaves the directory untouched.
        String encrypted;
        try {
            encrypted = cipher.encryptPassword(password);
        } catch (EncryptionException e) {
            throw new IssuanceException(IssuanceException.Kind.ENCRYPTION_FAILED, username,
                    "Failed to encrypt credential for user " + username, e);
        }

        UpsertResult result = null;
        if (settings.dryRun()) {
            log.info("Dry run: skipping directory upsert for user={}", username);
        } else {
            result = upsert(DirectoryUser.forIdentity(identity, password, assigned));
        }

        try {
            cacheStore.set(cacheKey, encrypted, settings.ttl());
        } catch (CacheUnavailableException e) {
            throw cacheFailure(username, e);
        }

        log.info("Issued credential: user={} roles={} directory={} took={}ms",
                username, assigned, describe(result),
                Duration.between(started, clock.instant()).toMillis());
        return new IssuedCredential(username, password, IssuanceState.ISSUED, false);
    }

    private UpsertResult upsert(DirectoryUser user) {
        UpsertResult result;
        try {
            result = directoryClient.upsertUser(user);
        } catch (DirectoryConnectException e) {
            throw new IssuanceException(IssuanceException.Kind.DIRECTORY_UNAVAILABLE, user.username(),
                    "Directory unavailable: " + e.getMessage(), e);
        }
        if (result instanceof UpsertResult.Rejected rejected) {
            log.warn("Directory rejected upsert: user={} status={}", user.username(), rejected.status());
            throw new IssuanceException(IssuanceException.Kind.DIRECTORY_REJECTED, user.username(),
                    "Directory rejected user " + user.username() + " with status " + rejected.status()
                            + ": " + rejected.body());
        }
        return result;
    }

    private String decrypt(String username, String encrypted) {
        try {
            return cipher.decryptPassword(encrypted);
        } catch (DecryptionException e) {
            throw new IssuanceException(IssuanceException.Kind.DECRYPTION_FAILED, username,
                    "Failed to decrypt cached credential for user " + username, e);
        }
    }

    private boolean acquire(String username, String lockKey, String token) {
        try {
            return cacheStore.tryLock(lockKey, token, settings.lockTtl());
        } catch (CacheUnavailableException e) {
            throw cacheFailure(username, e);
        }
    }

    private void release(String lockKey, String token) {
        try {
            cacheStore.unlock(lockKey, token);
        } catch (CacheUnavailableException e) {
            // the lock still expires after lockTtl
            log.warn("Failed to release issuance lock {}: {}", lockKey, e.getMessage());
        }
    }

    private void pause(String username) {
        try {
            Thread.sleep(settings.lockPollInterval().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IssuanceException(IssuanceException.Kind.LOCK_TIMEOUT, username,
                    "Interrupted while waiting for a concurrent issuance for user " + username, e);
        }
    }

    private static IssuanceException cacheFailure(String username, CacheUnavailableException e) {
        return new IssuanceException(IssuanceException.Kind.CACHE_UNAVAILABLE, username,
                "Credential cache unavailable: " + e.getMessage(), e);
    }

    private static String describe(UpsertResult result) {
        if (result == null) {
            return "skipped";
        }
        return result instanceof UpsertResult.Created ? "created" : "updated";
    }
}
