package com.certmanager.acme;

import com.certmanager.entity.DnsAuthenticatorEntity;

/**
 * DNS provider able to publish ACME challenge TXT records. Implementations are Spring beans,
 * selected by {@link #getType()} against {@link DnsAuthenticatorEntity#getAuthenticator()}.
 */
public interface DnsAuthenticator {

    String getType();

    /**
     * Publishes {@code digest} as TXT record {@code recordName} and returns once the record is
     * visible to the ACME server.
     */
    void updateTxtRecord(DnsAuthenticatorEntity authenticator, String domain, String recordName, String digest);
}
