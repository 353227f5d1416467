package com.certmanager.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.persistence.Entity;
import javax.persistence.Id;
import javax.persistence.Table;

@Data
@Entity
@Table(name = "system_settings")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemSettingsEntity {
    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    // CertificateEntity#id serving the administrative interface
    private Long uiCertificateId;
}
