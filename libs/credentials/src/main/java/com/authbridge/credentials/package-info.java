/**
 * Credential issuance core of the auth bridge.
 * <p>
 * Turns an {@link com.authbridge.credentials.Identity} asserted by a trusted reverse proxy into a
 * password for a native search-cluster account:
 * <ul>
 *   <li>{@link com.authbridge.credentials.HeaderAuthGate}: reads and validates identity headers</li>
 *   <li>{@link com.authbridge.credentials.CredentialIssuer}: serves a cached password or issues a new one</li>
 *   <li>{@link com.authbridge.credentials.RoleMapper}: groups to cluster roles</li>
 *   <li>{@link com.authbridge.credentials.CredentialCipher}: at-rest encryption of cached passwords</li>
 * </ul>
 * The cache and the remote user directory are consumed through
 * {@link com.authbridge.credentials.CacheStore} and {@link com.authbridge.credentials.DirectoryClient};
 * this package holds no network code of its own.
 */
package com.authbridge.credentials;
