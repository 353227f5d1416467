package com.certmanager.entity;

import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import javax.persistence.Entity;
import javax.persistence.Table;

@Entity
@Table(name = "certificate_authorities")
@SuperBuilder
@NoArgsConstructor
public class CertificateAuthorityEntity extends CertificateRecord {
}
