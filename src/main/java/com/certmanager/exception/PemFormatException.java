package com.certmanager.exception;

public class PemFormatException extends CertificateManagementException {
    public PemFormatException(String message) {
        super(message);
    }

    public PemFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
