package com.certmanager.acme;

import java.util.List;

public interface AcmeOrder {

    String getLocation();

    List<AcmeAuthorization> getAuthorizations();

    /**
     * Fetches the current state from the server.
     */
    OrderStatus refresh();

    /**
     * Submits the DER encoded CSR once the order is {@link OrderStatus#READY}.
     */
    void finalizeOrder(byte[] csr);

    /**
     * PEM encoded certificate followed by its issuers. Only available once the order is valid.
     */
    String downloadCertificateChain();
}
