package com.authbridge.bridge.infrastructure.proxy;

import org.springframework.http.HttpHeaders;

/**
 * A cluster answer, fully read.
 *
 * @param status HTTP status code
 * @param headers response headers, already stripped of the ones not passed to the client
 * @param body response body, possibly empty
 */
public record UpstreamResponse(int status, HttpHeaders headers, byte[] body) {}
