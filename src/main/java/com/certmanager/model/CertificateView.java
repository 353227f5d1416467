package com.certmanager.model;

import com.certmanager.entity.CertificateType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class CertificateView {
    Long id;
    CertificateType type;
    String name;
    String certificate;
    @JsonProperty("privatekey")
    String privateKey;
    @JsonProperty("CSR")
    String csr;
    BigInteger serial;
    @JsonProperty("signedby")
    Long signedBy;
    Integer keyLength;
    String digestAlgorithm;
    Integer lifetime;
    String country;
    String state;
    String city;
    String organization;
    String organizationalUnit;
    String common;
    String email;
    List<String> san;
    boolean chain;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    Long acme;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    String acmeUri;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Map<String, Long> domainsAuthenticators;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    Integer renewDays;

    String rootPath;
    String certificatePath;
    @JsonProperty("privatekey_path")
    String privateKeyPath;
    String csrPath;
    Issuer issuer;
    List<String> chainList;
    Instant from;
    Instant until;
    @JsonProperty("DN")
    String dn;
    String internal;
    String fingerprint;

    @JsonIgnore
    public boolean isAuthority() {
        return type != null && type.isAuthority();
    }

    @JsonIgnore
    public boolean isAcmeIssued() {
        return acme != null;
    }
}
