package com.certmanager.exception;

public class RecordNotFoundException extends CertificateManagementException {
    public RecordNotFoundException(String kind, Long id) {
        super(String.format("%s %d does not exist", kind, id));
    }
}
