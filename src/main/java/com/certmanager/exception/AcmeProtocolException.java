package com.certmanager.exception;

public class AcmeProtocolException extends CertificateManagementException {
    public AcmeProtocolException(String message) {
        super(message);
    }

    public AcmeProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
