package com.authbridge.bridge.api;

/**
 * Paths of the bridge's own endpoints.
 *
 * <p>Every endpoint is also served under {@link #PREFIX}, which is the only place it can be
 * reached in proxy mode: there, every other path belongs to the cluster.
 */
public final class BridgePaths {

    public static final String PREFIX = "/auth-bridge";
    public static final String ACTUATOR = "/actuator";

    private BridgePaths() {
        // constants
    }

    /** True for paths the bridge answers itself, whatever the operating mode. */
    public static boolean isBridgePath(String path) {
        return isUnder(path, PREFIX) || isUnder(path, ACTUATOR);
    }

    private static boolean isUnder(String path, String prefix) {
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }
}
