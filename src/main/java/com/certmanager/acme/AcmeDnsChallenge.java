package com.certmanager.acme;

public interface AcmeDnsChallenge {

    /**
     * Value to publish in the {@code _acme-challenge} TXT record.
     */
    String getDigest();

    /**
     * Tells the server the TXT record is in place.
     */
    void trigger();
}
