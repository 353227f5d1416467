package com.certmanager.entity;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import javax.persistence.Column;
import javax.persistence.EnumType;
import javax.persistence.Enumerated;
import javax.persistence.GeneratedValue;
import javax.persistence.GenerationType;
import javax.persistence.Id;
import javax.persistence.MappedSuperclass;
import java.math.BigInteger;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
@ToString(exclude = {"certificate", "privateKey", "csr"})
@MappedSuperclass
public abstract class CertificateRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = 120)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CertificateType type;

    @Column(columnDefinition = "TEXT")
    private String certificate;

    @Column(columnDefinition = "TEXT")
    private String privateKey;

    @Column(columnDefinition = "TEXT")
    private String csr;

    @Column(precision = 64)
    private BigInteger serial;

    // weak reference to CertificateAuthorityEntity#id
    private Long signedBy;

    private Integer keyLength;

    @Column(length = 10)
    private String digestAlgorithm;

    private Integer lifetime;

    @Column(length = 2)
    private String country;

    private String state;

    private String city;

    private String organization;

    private String organizationalUnit;

    private String common;

    private String email;

    @Column(length = 4096)
    private String san;

    private boolean chain;
}
