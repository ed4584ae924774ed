package com.authbridge.credentials;

import java.util.List;

/**
 * Identity headers were present but their values are not acceptable.
 */
public class InvalidHeaderException extends RuntimeException {

    private final List<String> errors;

    public InvalidHeaderException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    /** Every problem found, one message per field. */
    public List<String> errors() {
        return errors;
    }
}
