package com.certmanager.service;

import com.certmanager.crypto.CertificateBuilder;
import com.certmanager.crypto.DigestAlgorithm;
import com.certmanager.crypto.KeyPairs;
import com.certmanager.crypto.PemCodec;
import com.certmanager.crypto.SubjectCodec;
import com.certmanager.crypto.SubjectInfo;
import com.certmanager.entity.CertificateEntity;
import com.certmanager.entity.CertificateType;
import com.certmanager.exception.CertificateManagementException;
import com.certmanager.repository.CertificateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.util.Optional;

@Slf4j
@Component
public class DefaultCertificateInitializer implements ApplicationRunner {

    static final int DEFAULT_LIFETIME_DAYS = 3600;

    @Value("${pki.default-certificate.name:system_default}")
    private String defaultName;

    @Autowired
    private CertificateRepository certificateRepository;

    @Autowired
    private SystemSettingsService settingsService;

    @Autowired
    private ServiceReloadHook reloadHook;

    @Override
    public void run(ApplicationArguments args) {
        try {
            ensureUiCertificate();
        } catch (CertificateManagementException e) {
            log.warn("Unable to provision the default certificate: {}", e.getMessage(), e);
        }
    }

    /**
     * Returns the id of the certificate serving the UI, creating a self-signed default when the
     * configured one is unset or gone.
     */
    public Long ensureUiCertificate() {
        Long current = settingsService.getUiCertificateId();
        if (current != null && certificateRepository.existsById(current)) {
            return current;
        }

        Optional<CertificateEntity> existing = certificateRepository.findByName(defaultName);
        CertificateEntity certificate = existing.orElseGet(this::createDefault);
        settingsService.setUiCertificateId(certificate.getId());
        log.info("UI certificate set to {} (id {})", certificate.getName(), certificate.getId());
        return certificate.getId();
    }

    private CertificateEntity createDefault() {
        SubjectInfo subject = SubjectInfo.builder()
                .country("US")
                .organization("Appliance")
                .common("localhost")
                .build();
        KeyPair keyPair = KeyPairs.generateRsa(2048);
        X509Certificate certificate = CertificateBuilder
                .forSubject(SubjectCodec.toX500Name(subject), keyPair.getPublic())
                .selfSigned(keyPair.getPrivate())
                .serial(BigInteger.ONE)
                .lifetimeDays(DEFAULT_LIFETIME_DAYS)
                .digest(DigestAlgorithm.SHA256)
                .sign();

        CertificateEntity entity = CertificateEntity.builder()
                .name(defaultName)
                .type(CertificateType.CERT_EXISTING)
                .certificate(PemCodec.writeCertificate(certificate))
                .privateKey(PemCodec.writePrivateKey(keyPair.getPrivate()))
                .serial(BigInteger.ONE)
                .keyLength(2048)
                .digestAlgorithm(DigestAlgorithm.SHA256.name())
                .lifetime(DEFAULT_LIFETIME_DAYS)
                .build();
        Records.applySubject(entity, subject);
        CertificateEntity saved = certificateRepository.save(entity);
        log.info("Created default self-signed certificate {}", saved.getName());
        reloadHook.reload();
        return saved;
    }
}
