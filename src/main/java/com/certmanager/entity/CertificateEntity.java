package com.certmanager.entity;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import javax.persistence.Column;
import javax.persistence.Convert;
import javax.persistence.Entity;
import javax.persistence.Table;
import java.util.Map;

@Getter
@Setter
@Entity
@Table(name = "certificates")
@SuperBuilder
@NoArgsConstructor
public class CertificateEntity extends CertificateRecord {

    // AcmeRegistrationEntity#id, set only for ACME issued certificates
    private Long acmeRegistrationId;

    @Column(length = 512)
    private String acmeUri;

    @Convert(converter = DomainAuthenticatorsConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Long> domainsAuthenticators;

    private Integer renewDays;

    public boolean isAcme() {
        return acmeRegistrationId != null;
    }
}
