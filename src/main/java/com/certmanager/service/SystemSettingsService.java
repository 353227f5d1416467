package com.certmanager.service;

import com.certmanager.entity.SystemSettingsEntity;
import com.certmanager.repository.SystemSettingsRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class SystemSettingsService {

    @Autowired
    private SystemSettingsRepository settingsRepository;

    public SystemSettingsEntity getSettings() {
        return settingsRepository.findById(SystemSettingsEntity.SINGLETON_ID)
                .orElseGet(() -> SystemSettingsEntity.builder().id(SystemSettingsEntity.SINGLETON_ID).build());
    }

    /**
     * Id of the certificate serving the administrative interface, {@code null} when unset.
     */
    public Long getUiCertificateId() {
        return getSettings().getUiCertificateId();
    }

    public SystemSettingsEntity setUiCertificateId(Long certificateId) {
        SystemSettingsEntity settings = getSettings();
        settings.setUiCertificateId(certificateId);
        return settingsRepository.save(settings);
    }
}
