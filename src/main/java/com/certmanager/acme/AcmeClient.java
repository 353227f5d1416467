package com.certmanager.acme;

import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * ACME protocol operations the issuance workflow depends on. Every failure surfaces as
 * {@link com.certmanager.exception.AcmeProtocolException}.
 */
public interface AcmeClient {

    /**
     * Terms of service URI announced by the directory, {@code null} when there is none.
     */
    String termsOfService(String directoryUri);

    /**
     * Creates an account for the key pair, agreeing to the terms of service.
     *
     * @return the account location
     */
    String register(String directoryUri, KeyPair accountKey);

    AcmeOrder newOrder(AcmeAccount account, List<String> domains);

    void revoke(AcmeAccount account, X509Certificate certificate);
}
