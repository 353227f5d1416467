package com.certmanager.acme;

public interface AcmeAuthorization {

    /**
     * Domain being authorized, without the {@code *.} prefix of wildcard identifiers.
     */
    String getDomain();

    boolean isWildcard();

    boolean isValid();

    /**
     * The {@code dns-01} challenge offered for this domain, {@code null} if the server offers none.
     */
    AcmeDnsChallenge findDnsChallenge();
}
