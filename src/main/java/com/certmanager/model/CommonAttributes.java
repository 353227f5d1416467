package com.certmanager.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CommonAttributes {
    String country;
    String certificate;
    String privateKey;
    String passphrase;
    Integer keyLength;
    Long signedBy;
    String csr;
    Long csrId;
}
