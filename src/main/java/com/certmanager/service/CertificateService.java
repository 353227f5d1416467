package com.certmanager.service;

import com.certmanager.config.AcmeConfig;
import com.certmanager.crypto.CertificateBuilder;
import com.certmanager.crypto.CsrFactory;
import com.certmanager.crypto.DigestAlgorithm;
import com.certmanager.crypto.Fingerprints;
import com.certmanager.crypto.KeyPairs;
import com.certmanager.crypto.PemCodec;
import com.certmanager.crypto.SubjectCodec;
import com.certmanager.entity.AcmeRegistrationEntity;
import com.certmanager.entity.CertificateAuthorityEntity;
import com.certmanager.entity.CertificateEntity;
import com.certmanager.entity.CertificateType;
import com.certmanager.exception.AcmeProtocolException;
import com.certmanager.exception.CertificateManagementException;
import com.certmanager.exception.PolicyViolationException;
import com.certmanager.exception.RecordNotFoundException;
import com.certmanager.exception.ValidationErrors;
import com.certmanager.model.CertificateCreateRequest;
import com.certmanager.model.CertificateUpdateRequest;
import com.certmanager.model.CertificateView;
import com.certmanager.model.IssuedCertificate;
import com.certmanager.model.SubjectRequest;
import com.certmanager.repository.CertificateAuthorityRepository;
import com.certmanager.repository.CertificateRepository;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
public class CertificateService {

    static final String CREATE_SCHEMA = "certificate_create";
    static final String UPDATE_SCHEMA = "certificate_update";
    static final String DELETE_SCHEMA = "certificate_delete";

    @Autowired
    private CertificateRepository certificateRepository;

    @Autowired
    private CertificateAuthorityRepository authorityRepository;

    @Autowired
    private CertificateExtender extender;

    @Autowired
    private SerialNumberAllocator serialAllocator;

    @Autowired
    private CertificateNameValidator nameValidator;

    @Autowired
    private CommonAttributeValidator attributeValidator;

    @Autowired
    private AcmeIssuanceService acmeIssuanceService;

    @Autowired
    private AcmeRegistrationService registrationService;

    @Autowired
    private SystemSettingsService settingsService;

    @Autowired
    private OperationLocks locks;

    @Autowired
    private ServiceReloadHook reloadHook;

    @Autowired
    private AcmeConfig acmeConfig;

    public List<CertificateView> query() {
        return certificateRepository.findAll().stream()
                .map(extender::extend)
                .collect(Collectors.toList());
    }

    public CertificateView get(Long id) {
        return extender.extend(find(id));
    }

    /**
     * SHA-1 fingerprint of the certificate, {@code null} when it holds no decodable certificate.
     */
    public String fingerprint(Long id) {
        CertificateEntity certificate = find(id);
        if (certificate.getCertificate() == null || certificate.getCertificate().isEmpty()) {
            return null;
        }
        try {
            return Fingerprints.sha1(PemCodec.parseCertificate(certificate.getCertificate()));
        } catch (CertificateManagementException e) {
            log.debug("No fingerprint for {}", certificate.getName(), e);
            return null;
        }
    }

    public Map<String, String> acmeServerChoices() {
        return acmeConfig.getServerChoices();
    }

    public CertificateView create(CertificateCreateRequest request) {
        return create(request, JobProgress.logging("certificate.create"));
    }

    public CertificateView create(CertificateCreateRequest request, JobProgress progress) {
        try (OperationLocks.Guard guard = locks.acquire(OperationLocks.Category.CERTIFICATE_CREATE)) {
            ValidationErrors errors = attributeValidator.validate(request.getCommonAttributes(), CREATE_SCHEMA);
            nameValidator.validate(request.getName(), CREATE_SCHEMA + ".name", errors);
            errors.throwIfAny();
            progress.update(10, "Initial validation complete");

            CertificateEntity certificate = request.accept(new Creator(progress));
            certificate.setName(request.getName());
            if (certificate.getSan() == null) {
                certificate.setSan("");
            }
            CertificateEntity saved = certificateRepository.save(certificate);
            log.info("Created certificate {} ({})", saved.getName(), saved.getType());

            reloadHook.reload();
            progress.update(100, "Certificate created");
            return extender.extend(saved);
        }
    }

    public CertificateView update(Long id, CertificateUpdateRequest request) {
        try (OperationLocks.Guard guard = locks.acquire(OperationLocks.Category.CERTIFICATE_UPDATE)) {
            CertificateEntity certificate = find(id);
            String name = request.getName();
            if (name != null && !name.equals(certificate.getName())) {
                nameValidator.validate(name, UPDATE_SCHEMA + ".name", new ValidationErrors()).throwIfAny();
                certificate.setName(name);
                certificate = certificateRepository.save(certificate);
                reloadHook.reload();
            }
            return extender.extend(certificate);
        }
    }

    /**
     * Deletes a certificate. ACME certificates are revoked first; a failed revocation aborts the
     * delete unless {@code force} is set.
     */
    public void delete(Long id, boolean force) {
        try (OperationLocks.Guard guard = locks.acquire(OperationLocks.Category.CERTIFICATE_DELETE)) {
            if (id.equals(settingsService.getUiCertificateId())) {
                throw new PolicyViolationException(DELETE_SCHEMA + ".id",
                        "Selected certificate is being used by system HTTPS server, please select another one");
            }
            CertificateEntity certificate = find(id);

            if (certificate.isAcme()) {
                try {
                    acmeIssuanceService.revoke(certificate);
                } catch (CertificateManagementException e) {
                    if (!force) {
                        throw e instanceof AcmeProtocolException ? e
                                : new AcmeProtocolException("Failed to revoke certificate: " + e.getMessage(), e);
                    }
                    log.warn("Revocation of {} failed, deleting anyway: {}", certificate.getName(), e.getMessage());
                }
            }

            certificateRepository.delete(certificate);
            log.info("Deleted certificate {}", certificate.getName());
            reloadHook.reload();
        }
    }

    private CertificateEntity find(Long id) {
        return certificateRepository.findById(id)
                .orElseThrow(() -> new RecordNotFoundException("Certificate", id));
    }

    private static void requireSubject(ValidationErrors errors, SubjectRequest request) {
        Records.require(errors, CREATE_SCHEMA, "key_length", request.getKeyLength());
        Records.require(errors, CREATE_SCHEMA, "digest_algorithm", request.getDigestAlgorithm());
        Records.require(errors, CREATE_SCHEMA, "country", request.getCountry());
        Records.require(errors, CREATE_SCHEMA, "state", request.getState());
        Records.require(errors, CREATE_SCHEMA, "city", request.getCity());
        Records.require(errors, CREATE_SCHEMA, "organization", request.getOrganization());
        Records.require(errors, CREATE_SCHEMA, "email", request.getEmail());
        Records.require(errors, CREATE_SCHEMA, "common", request.getCommon());
        if (request.getDigestAlgorithm() != null && !request.getDigestAlgorithm().isEmpty()) {
            try {
                DigestAlgorithm.parse(request.getDigestAlgorithm(), null);
            } catch (IllegalArgumentException e) {
                errors.add(CREATE_SCHEMA + ".digest_algorithm",
                        "Digest algorithm must be one of SHA1, SHA224, SHA256, SHA384, SHA512");
            }
        }
    }

    private static CertificateEntity fromSubject(SubjectRequest request, CertificateType type) {
        CertificateEntity certificate = CertificateEntity.builder()
                .type(type)
                .keyLength(request.getKeyLength())
                .digestAlgorithm(DigestAlgorithm.parse(request.getDigestAlgorithm(), DigestAlgorithm.SHA256).name())
                .build();
        Records.applySubject(certificate, request.toSubjectInfo());
        return certificate;
    }

    private static String withoutPassphrase(String privateKey, String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            return PemCodec.normalizePrivateKey(privateKey);
        }
        return PemCodec.writePrivateKey(PemCodec.parsePrivateKey(privateKey, passphrase));
    }

    /**
     * Builds the unsaved record for each creation variant.
     */
    private final class Creator implements CertificateCreateRequest.Visitor<CertificateEntity> {
        private final JobProgress progress;

        private Creator(JobProgress progress) {
            this.progress = progress;
        }

        @Override
        public CertificateEntity visitInternal(CertificateCreateRequest.Internal request) {
            ValidationErrors errors = new ValidationErrors();
            requireSubject(errors, request);
            Records.require(errors, CREATE_SCHEMA, "lifetime", request.getLifetime());
            Records.require(errors, CREATE_SCHEMA, "signedby", request.getSignedBy());
            errors.throwIfAny();

            CertificateAuthorityEntity ca = authorityRepository.findById(request.getSignedBy())
                    .orElseThrow(() -> new RecordNotFoundException("Certificate authority", request.getSignedBy()));
            X509Certificate caCertificate = PemCodec.parseCertificate(ca.getCertificate());
            PrivateKey caKey = PemCodec.parsePrivateKey(ca.getPrivateKey());

            KeyPair keyPair = KeyPairs.generateRsa(request.getKeyLength());
            progress.update(50, "Key pair generated");

            CertificateEntity certificate = fromSubject(request, CertificateType.CERT_INTERNAL);
            certificate.setSerial(serialAllocator.nextSerial(ca.getId()));
            X509Certificate signed = CertificateBuilder
                    .forSubject(SubjectCodec.toX500Name(request.toSubjectInfo()), keyPair.getPublic())
                    .issuedBy(SubjectCodec.subjectOf(caCertificate), caKey)
                    .serial(certificate.getSerial())
                    .lifetimeDays(request.getLifetime())
                    .subjectAltNames(request.getSan())
                    .subjectKeyIdentifier()
                    .digest(DigestAlgorithm.parse(request.getDigestAlgorithm(), DigestAlgorithm.SHA256))
                    .sign();

            certificate.setCertificate(PemCodec.writeCertificate(signed));
            certificate.setPrivateKey(PemCodec.writePrivateKey(keyPair.getPrivate()));
            certificate.setSignedBy(ca.getId());
            certificate.setLifetime(request.getLifetime());
            progress.update(90, "Finalizing changes");
            return certificate;
        }

        @Override
        public CertificateEntity visitCsr(CertificateCreateRequest.Csr request) {
            ValidationErrors errors = new ValidationErrors();
            requireSubject(errors, request);
            errors.throwIfAny();

            KeyPair keyPair = KeyPairs.generateRsa(request.getKeyLength());
            PKCS10CertificationRequest csr = CsrFactory.create(request.toSubjectInfo(), keyPair,
                    DigestAlgorithm.parse(request.getDigestAlgorithm(), DigestAlgorithm.SHA256));
            progress.update(80);

            CertificateEntity certificate = fromSubject(request, CertificateType.CERT_CSR);
            certificate.setCsr(PemCodec.writeCsr(csr));
            certificate.setPrivateKey(PemCodec.writePrivateKey(keyPair.getPrivate()));
            progress.update(90, "Finalizing changes");
            return certificate;
        }

        @Override
        public CertificateEntity visitImported(CertificateCreateRequest.Imported request) {
            ValidationErrors errors = new ValidationErrors();
            Records.require(errors, CREATE_SCHEMA, "certificate", request.getCertificate());
            String privateKey;
            if (request.getCsrId() != null) {
                CertificateEntity csrHolder = find(request.getCsrId());
                privateKey = PemCodec.normalizePrivateKey(csrHolder.getPrivateKey());
                if (errors.isEmpty() && !KeyPairs.matches(PemCodec.parseCertificate(request.getCertificate()),
                        PemCodec.parsePrivateKey(privateKey))) {
                    errors.add(CREATE_SCHEMA + ".certificate", "Certificate does not match the private key of the CSR");
                }
            } else if (request.getPrivateKey() == null || request.getPrivateKey().isEmpty()) {
                errors.add(CREATE_SCHEMA + ".privatekey", "Private key is required when importing a certificate");
                privateKey = null;
            } else {
                privateKey = withoutPassphrase(request.getPrivateKey(), request.getPassphrase());
            }
            errors.throwIfAny();
            progress.update(50, "Validation complete");

            CertificateEntity certificate = CertificateEntity.builder()
                    .type(CertificateType.CERT_EXISTING)
                    .certificate(request.getCertificate())
                    .privateKey(privateKey)
                    .chain(PemCodec.isChain(request.getCertificate()))
                    .build();
            Records.applyCertificateInfo(certificate,
                    SubjectCodec.describe(PemCodec.parseCertificate(request.getCertificate())));
            progress.update(90, "Finalizing changes");
            return certificate;
        }

        @Override
        public CertificateEntity visitImportedCsr(CertificateCreateRequest.ImportedCsr request) {
            ValidationErrors errors = new ValidationErrors();
            Records.require(errors, CREATE_SCHEMA, "CSR", request.getCsr());
            Records.require(errors, CREATE_SCHEMA, "privatekey", request.getPrivateKey());
            errors.throwIfAny();

            PKCS10CertificationRequest csr = PemCodec.parseCsr(request.getCsr());
            CertificateEntity certificate = CertificateEntity.builder()
                    .type(CertificateType.CERT_CSR)
                    .csr(PemCodec.writeCsr(csr))
                    .privateKey(withoutPassphrase(request.getPrivateKey(), request.getPassphrase()))
                    .build();
            Records.applySubject(certificate, SubjectCodec.describe(csr));
            progress.update(90, "Finalizing changes");
            return certificate;
        }

        @Override
        public CertificateEntity visitAcme(CertificateCreateRequest.Acme request) {
            ValidationErrors errors = new ValidationErrors();
            Records.require(errors, "acme_create", "csr_id", request.getCsrId());
            Records.require(errors, "acme_create", "acme_directory_uri", request.getAcmeDirectoryUri());
            Records.require(errors, "acme_create", "dns_mapping", request.getDnsMapping());
            if (request.getRenewDays() == null || request.getRenewDays() < 1) {
                errors.add("acme_create.renew_days", "Renew days must be at least 1");
            }
            errors.throwIfAny();

            CertificateEntity csrHolder = find(request.getCsrId());
            String directory = request.getAcmeDirectoryUri().endsWith("/")
                    ? request.getAcmeDirectoryUri() : request.getAcmeDirectoryUri() + "/";

            IssuedCertificate issued = acmeIssuanceService.issue(directory, request.isTos(),
                    request.getDnsMapping(), csrHolder, progress, 25);
            progress.update(95, "Final order received from ACME server");

            AcmeRegistrationEntity registration = registrationService.findByDirectory(directory)
                    .orElseThrow(() -> new AcmeProtocolException("No ACME registration stored for " + directory));
            CertificateEntity certificate = CertificateEntity.builder()
                    .type(CertificateType.CERT_EXISTING)
                    .acmeRegistrationId(registration.getId())
                    .acmeUri(issued.getOrderUri())
                    .certificate(issued.getFullChainPem())
                    .csr(csrHolder.getCsr())
                    .privateKey(csrHolder.getPrivateKey())
                    .chain(issued.isChain())
                    .domainsAuthenticators(request.getDnsMapping())
                    .renewDays(request.getRenewDays())
                    .build();
            Records.applyCertificateInfo(certificate,
                    SubjectCodec.describe(PemCodec.parseCertificate(issued.getFullChainPem())));
            return certificate;
        }

        @Override
        public CertificateEntity visitSigned(CertificateCreateRequest.Signed request) {
            ValidationErrors errors = new ValidationErrors();
            Records.require(errors, CREATE_SCHEMA, "certificate", request.getCertificate());
            Records.require(errors, CREATE_SCHEMA, "privatekey", request.getPrivateKey());
            Records.require(errors, CREATE_SCHEMA, "type", request.getType());
            errors.throwIfAny();

            CertificateEntity certificate = CertificateEntity.builder()
                    .type(request.getType())
                    .certificate(request.getCertificate())
                    .privateKey(request.getPrivateKey())
                    .signedBy(request.getSignedBy())
                    .chain(PemCodec.isChain(request.getCertificate()))
                    .build();
            Records.applyCertificateInfo(certificate,
                    SubjectCodec.describe(PemCodec.parseCertificate(request.getCertificate())));
            progress.update(90, "Finalizing changes");
            return certificate;
        }
    }
}
