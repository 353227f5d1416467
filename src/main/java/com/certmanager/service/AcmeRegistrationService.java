package com.certmanager.service;

import com.certmanager.acme.AcmeAccount;
import com.certmanager.acme.AcmeClient;
import com.certmanager.config.AcmeConfig;
import com.certmanager.entity.AcmeRegistrationEntity;
import com.certmanager.exception.CertificateManagementException;
import com.certmanager.exception.RecordNotFoundException;
import com.certmanager.exception.ValidationException;
import com.certmanager.repository.AcmeRegistrationRepository;
import lombok.extern.slf4j.Slf4j;
import org.shredzone.acme4j.util.KeyPairUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.security.KeyPair;
import java.time.LocalDateTime;
import java.util.Optional;

@Slf4j
@Service
public class AcmeRegistrationService {

    @Autowired
    private AcmeRegistrationRepository registrationRepository;

    @Autowired
    private AcmeClient acmeClient;

    @Autowired
    private AcmeConfig acmeConfig;

    public Optional<AcmeRegistrationEntity> findByDirectory(String directoryUri) {
        return registrationRepository.findByDirectory(directoryUri);
    }

    public AcmeRegistrationEntity get(Long id) {
        return registrationRepository.findById(id)
                .orElseThrow(() -> new RecordNotFoundException("ACME registration", id));
    }

    /**
     * Account for the directory, registering a new one when none is stored yet.
     *
     * @param tos whether the user agreed to the directory's terms of service, required for a
     *            new registration
     */
    public AcmeAccount resolve(String directoryUri, boolean tos) {
        Optional<AcmeRegistrationEntity> existing = registrationRepository.findByDirectory(directoryUri);
        if (existing.isPresent()) {
            return toAccount(existing.get());
        }
        if (!tos) {
            throw ValidationException.of("acme_registration.tos", "Please agree to the terms of service");
        }

        KeyPair keyPair = KeyPairUtils.createKeyPair(acmeConfig.getAccountKeySize());
        String termsOfService = acmeClient.termsOfService(directoryUri);
        String location = acmeClient.register(directoryUri, keyPair);

        AcmeRegistrationEntity registration = registrationRepository.save(AcmeRegistrationEntity.builder()
                .directory(directoryUri)
                .uri(location)
                .tos(termsOfService)
                .accountKeyPair(writeKeyPair(keyPair))
                .createdAt(LocalDateTime.now())
                .build());
        log.info("Registered ACME account {} with {}", location, directoryUri);
        return toAccount(registration);
    }

    public AcmeAccount toAccount(AcmeRegistrationEntity registration) {
        return new AcmeAccount(registration.getDirectory(), registration.getUri(),
                readKeyPair(registration.getAccountKeyPair()));
    }

    private static String writeKeyPair(KeyPair keyPair) {
        StringWriter writer = new StringWriter();
        try {
            KeyPairUtils.writeKeyPair(keyPair, writer);
        } catch (IOException e) {
            throw new CertificateManagementException("Unable to encode ACME account key", e);
        }
        return writer.toString();
    }

    private static KeyPair readKeyPair(String pem) {
        try {
            return KeyPairUtils.readKeyPair(new StringReader(pem));
        } catch (IOException e) {
            throw new CertificateManagementException("Unable to load ACME account key", e);
        }
    }
}
