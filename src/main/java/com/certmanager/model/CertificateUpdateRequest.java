package com.certmanager.model;

import lombok.Data;

@Data
public class CertificateUpdateRequest {
    private String name;    // only the name of a stored record may change
}
