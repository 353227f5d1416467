package com.certmanager.entity;

public enum CertificateType {
    CA_EXISTING(true),
    CA_INTERNAL(true),
    CA_INTERMEDIATE(true),
    CERT_EXISTING(false),
    CERT_INTERNAL(false),
    CERT_CSR(false);

    private final boolean authority;

    CertificateType(boolean authority) {
        this.authority = authority;
    }

    public boolean isAuthority() {
        return authority;
    }

    /**
     * Imported material whose issuer is outside of this system.
     */
    public boolean isExternal() {
        return this == CA_EXISTING || this == CERT_EXISTING;
    }
}
