package com.authbridge.credentials;

/**
 * A header the bridge needs was not sent by the proxy.
 * <p>
 * Not a server fault: the HTTP layer answers with the informational payload.
 */
public class MissingHeaderException extends RuntimeException {

    private final String header;

    public MissingHeaderException(String header) {
        super("Header not provided: " + header);
        this.header = header;
    }

    /** Name of the missing header. */
    public String header() {
        return header;
    }
}
