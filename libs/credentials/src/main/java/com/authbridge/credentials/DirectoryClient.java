package com.authbridge.credentials;

/**
 * Remote user directory of the search cluster (its native realm).
 * <p>
 * One instance is shared by all requests.
 */
public interface DirectoryClient {

    /**
     * Checks that the management credentials are accepted by the directory.
     *
     * @throws DirectoryAuthenticationException if the directory refuses the credentials
     * @throws DirectoryConnectException        if the directory cannot be reached
     */
    void authenticate();

    /**
     * Creates or replaces the user record.
     *
     * @return the tagged outcome; never null
     * @throws DirectoryConnectException if the directory cannot be reached
     */
    UpsertResult upsertUser(DirectoryUser user);
}
