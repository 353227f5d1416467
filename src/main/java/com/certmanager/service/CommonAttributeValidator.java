package com.certmanager.service;

import com.certmanager.crypto.KeyPairs;
import com.certmanager.crypto.PemCodec;
import com.certmanager.entity.CertificateAuthorityEntity;
import com.certmanager.entity.CertificateEntity;
import com.certmanager.exception.PassphraseException;
import com.certmanager.exception.PemFormatException;
import com.certmanager.exception.ValidationErrors;
import com.certmanager.model.CommonAttributes;
import com.certmanager.repository.CertificateAuthorityRepository;
import com.certmanager.repository.CertificateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks shared by every creation variant. All findings are collected, nothing is thrown.
 */
@Slf4j
@Component
public class CommonAttributeValidator {

    static final List<Integer> KEY_LENGTHS = Arrays.asList(1024, 2048, 4096);

    private static final Set<String> COUNTRIES = new HashSet<>(Arrays.asList(Locale.getISOCountries()));

    @Autowired
    private CertificateRepository certificateRepository;

    @Autowired
    private CertificateAuthorityRepository authorityRepository;

    public ValidationErrors validate(CommonAttributes attributes, String schema) {
        ValidationErrors errors = new ValidationErrors();

        String country = attributes.getCountry();
        if (country != null && !country.isEmpty() && !COUNTRIES.contains(country)) {
            errors.add(schema + ".country", country + " is not a valid ISO 3166-1 alpha-2 country code");
        }

        X509Certificate certificate = null;
        String certificatePem = attributes.getCertificate();
        if (certificatePem != null && !certificatePem.isEmpty()) {
            if (PemCodec.splitCertificates(certificatePem).isEmpty()) {
                errors.add(schema + ".certificate", "Not a valid certificate");
            } else {
                try {
                    certificate = PemCodec.parseCertificate(certificatePem);
                } catch (PemFormatException e) {
                    errors.add(schema + ".certificate", "Certificate not in PEM format");
                }
            }
        }

        PrivateKey privateKey = null;
        String privateKeyPem = attributes.getPrivateKey();
        if (privateKeyPem != null && !privateKeyPem.isEmpty()) {
            try {
                privateKey = PemCodec.parsePrivateKey(privateKeyPem, attributes.getPassphrase());
            } catch (PassphraseException e) {
                errors.add(schema + ".passphrase", e.getMessage());
            } catch (PemFormatException e) {
                errors.add(schema + ".privatekey", "Please provide a valid private key with matching passphrase ( if any )");
            }
        }

        Integer keyLength = attributes.getKeyLength();
        if (keyLength != null && !KEY_LENGTHS.contains(keyLength)) {
            errors.add(schema + ".key_length", "Key length must be a valid value ( 1024, 2048, 4096 )");
        }

        Long signedBy = attributes.getSignedBy();
        if (signedBy != null && !isUsableSigningAuthority(signedBy)) {
            errors.add(schema + ".signedby", "Please provide a valid signing authority");
        }

        String csr = attributes.getCsr();
        if (csr != null && !csr.isEmpty()) {
            try {
                PemCodec.parseCsr(csr);
            } catch (PemFormatException e) {
                errors.add(schema + ".CSR", "Please provide a valid CSR");
            }
        }

        Long csrId = attributes.getCsrId();
        if (csrId != null && !holdsCsr(csrId)) {
            errors.add(schema + ".csr_id", "Please provide a valid csr_id which has a valid CSR filed");
        }

        if (certificate != null && privateKey != null && !KeyPairs.matches(certificate, privateKey)) {
            errors.add(schema + ".privatekey", "Private key does not match certificate");
        }
        return errors;
    }

    private boolean isUsableSigningAuthority(Long id) {
        return authorityRepository.findById(id)
                .map(CommonAttributeValidator::hasCertificateAndKey)
                .orElse(false);
    }

    static boolean hasCertificateAndKey(CertificateAuthorityEntity ca) {
        return ca.getCertificate() != null && !ca.getCertificate().isEmpty()
                && ca.getPrivateKey() != null && !ca.getPrivateKey().isEmpty();
    }

    private boolean holdsCsr(Long id) {
        return certificateRepository.findById(id)
                .map(CertificateEntity::getCsr)
                .map(csr -> !csr.isEmpty())
                .orElse(false);
    }
}
