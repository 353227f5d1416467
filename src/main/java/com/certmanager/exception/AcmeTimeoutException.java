package com.certmanager.exception;

public class AcmeTimeoutException extends CertificateManagementException {
    public AcmeTimeoutException(String message) {
        super(message);
    }
}
