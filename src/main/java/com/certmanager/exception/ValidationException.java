package com.certmanager.exception;

public class ValidationException extends CertificateManagementException {

    private final ValidationErrors errors;

    public ValidationException(ValidationErrors errors) {
        super(errors.toString());
        this.errors = errors;
    }

    public static ValidationException of(String field, String message) {
        return new ValidationException(new ValidationErrors().add(field, message));
    }

    public ValidationErrors getErrors() {
        return errors;
    }
}
