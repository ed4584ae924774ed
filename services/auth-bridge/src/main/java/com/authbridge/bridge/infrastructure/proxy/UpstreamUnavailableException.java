package com.authbridge.bridge.infrastructure.proxy;

/**
 * The cluster could not be reached, or its answer could not be read.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
