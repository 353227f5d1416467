package com.certmanager.model;

import com.certmanager.crypto.PemCodec;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssuedCertificate {
    // leaf first, followed by the issuers returned by the directory
    private String fullChainPem;
    private String orderUri;

    @JsonIgnore
    public boolean isChain() {
        return PemCodec.isChain(fullChainPem);
    }

    @JsonIgnore
    public List<String> getCertificates() {
        return PemCodec.splitCertificates(fullChainPem);
    }
}
