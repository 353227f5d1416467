package com.certmanager.service;

import com.certmanager.acme.DnsAuthenticator;
import com.certmanager.entity.CertificateEntity;
import com.certmanager.entity.DnsAuthenticatorEntity;
import com.certmanager.exception.AcmeProtocolException;
import com.certmanager.exception.RecordNotFoundException;
import com.certmanager.exception.ValidationErrors;
import com.certmanager.repository.CertificateRepository;
import com.certmanager.repository.DnsAuthenticatorRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
public class DnsAuthenticatorService {

    static final String CHALLENGE_PREFIX = "_acme-challenge.";

    @Autowired
    private DnsAuthenticatorRepository authenticatorRepository;

    @Autowired
    private CertificateRepository certificateRepository;

    @Autowired(required = false)
    private List<DnsAuthenticator> providers = Collections.emptyList();

    public List<DnsAuthenticatorEntity> query() {
        return authenticatorRepository.findAll();
    }

    public boolean exists(Long id) {
        return id != null && authenticatorRepository.existsById(id);
    }

    public DnsAuthenticatorEntity create(DnsAuthenticatorEntity authenticator) {
        ValidationErrors errors = new ValidationErrors();
        if (authenticator.getName() == null || authenticator.getName().trim().isEmpty()) {
            errors.add("dns_authenticator_create.name", "This field is required");
        } else if (authenticatorRepository.findAll().stream()
                .anyMatch(a -> a.getName().equals(authenticator.getName()))) {
            errors.add("dns_authenticator_create.name", "A DNS authenticator with this name already exists");
        }
        if (providerFor(authenticator.getAuthenticator()) == null) {
            errors.add("dns_authenticator_create.authenticator",
                    "Unknown authenticator type " + authenticator.getAuthenticator());
        }
        errors.throwIfAny();
        authenticator.setId(null);
        return authenticatorRepository.save(authenticator);
    }

    /**
     * Publishes the challenge digest for {@code domain} through the provider of the authenticator.
     */
    public void updateTxtRecord(Long authenticatorId, String domain, String digest) {
        DnsAuthenticatorEntity authenticator = authenticatorRepository.findById(authenticatorId)
                .orElseThrow(() -> new RecordNotFoundException("DNS authenticator", authenticatorId));
        DnsAuthenticator provider = providerFor(authenticator.getAuthenticator());
        if (provider == null) {
            throw new AcmeProtocolException("No DNS provider available for authenticator type "
                    + authenticator.getAuthenticator());
        }
        log.debug("Publishing TXT record for {} via {}", domain, authenticator.getName());
        try {
            provider.updateTxtRecord(authenticator, domain, CHALLENGE_PREFIX + domain, digest);
        } catch (RuntimeException e) {
            throw new AcmeProtocolException("Failed to update TXT record for " + domain + ": " + e.getMessage(), e);
        }
    }

    /**
     * Deletes the authenticator and drops it from the domain mapping of every ACME certificate.
     */
    @Transactional
    public void delete(Long id) {
        DnsAuthenticatorEntity authenticator = authenticatorRepository.findById(id)
                .orElseThrow(() -> new RecordNotFoundException("DNS authenticator", id));
        for (CertificateEntity certificate : certificateRepository.findByAcmeRegistrationIdIsNotNull()) {
            Map<String, Long> mapping = certificate.getDomainsAuthenticators();
            if (mapping != null && mapping.containsValue(id)) {
                certificate.setDomainsAuthenticators(mapping.entrySet().stream()
                        .filter(e -> !id.equals(e.getValue()))
                        .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue)));
                certificateRepository.save(certificate);
            }
        }
        authenticatorRepository.delete(authenticator);
        log.info("Deleted DNS authenticator {}", authenticator.getName());
    }

    private DnsAuthenticator providerFor(String type) {
        for (DnsAuthenticator provider : providers) {
            if (provider.getType().equals(type)) {
                return provider;
            }
        }
        return null;
    }
}
