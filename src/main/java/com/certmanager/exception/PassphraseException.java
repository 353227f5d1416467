package com.certmanager.exception;

public class PassphraseException extends CertificateManagementException {
    public PassphraseException(String message) {
        super(message);
    }

    public PassphraseException(String message, Throwable cause) {
        super(message, cause);
    }
}
