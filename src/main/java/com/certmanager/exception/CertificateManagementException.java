package com.certmanager.exception;

public class CertificateManagementException extends RuntimeException {
    public CertificateManagementException(String message) {
        super(message);
    }

    public CertificateManagementException(String message, Throwable cause) {
        super(message, cause);
    }
}
