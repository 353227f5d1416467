package com.certmanager.exception;

/**
 * Operation refused outright because it would break a running service, e.g. deleting the
 * certificate that serves the administrative interface.
 */
public class PolicyViolationException extends ValidationException {
    public PolicyViolationException(String field, String message) {
        super(new ValidationErrors().add(field, message));
    }
}
