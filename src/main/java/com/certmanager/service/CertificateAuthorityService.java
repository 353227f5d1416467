package com.certmanager.service;

import com.certmanager.crypto.CertificateBuilder;
import com.certmanager.crypto.CsrFactory;
import com.certmanager.crypto.DigestAlgorithm;
import com.certmanager.crypto.KeyPairs;
import com.certmanager.crypto.PemCodec;
import com.certmanager.crypto.SubjectCodec;
import com.certmanager.entity.CertificateAuthorityEntity;
import com.certmanager.entity.CertificateEntity;
import com.certmanager.entity.CertificateType;
import com.certmanager.exception.CertificateManagementException;
import com.certmanager.exception.RecordNotFoundException;
import com.certmanager.exception.ValidationErrors;
import com.certmanager.model.CaCreateRequest;
import com.certmanager.model.CaSignCsrRequest;
import com.certmanager.model.CertificateCreateRequest;
import com.certmanager.model.CertificateUpdateRequest;
import com.certmanager.model.CertificateView;
import com.certmanager.repository.CertificateAuthorityRepository;
import com.certmanager.repository.CertificateRepository;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
public class CertificateAuthorityService {

    static final String CREATE_SCHEMA = "certificate_authority_create";
    static final String UPDATE_SCHEMA = "certificate_authority_update";
    static final String SIGN_SCHEMA = "ca_sign_csr";

    static final int SIGNED_CSR_LIFETIME_DAYS = 365 * 10;

    private static final SecureRandom RANDOM = new SecureRandom();

    @Autowired
    private CertificateAuthorityRepository authorityRepository;

    @Autowired
    private CertificateRepository certificateRepository;

    @Autowired
    private CertificateService certificateService;

    @Autowired
    private CertificateExtender extender;

    @Autowired
    private SerialNumberAllocator serialAllocator;

    @Autowired
    private CertificateNameValidator nameValidator;

    @Autowired
    private CommonAttributeValidator attributeValidator;

    @Autowired
    private OperationLocks locks;

    @Autowired
    private ServiceReloadHook reloadHook;

    public List<CertificateView> query() {
        return authorityRepository.findAll().stream()
                .map(extender::extend)
                .collect(Collectors.toList());
    }

    public CertificateView get(Long id) {
        return extender.extend(find(id));
    }

    public CertificateView create(CaCreateRequest request) {
        try (OperationLocks.Guard guard = locks.acquire(OperationLocks.Category.CERTIFICATE_CREATE)) {
            ValidationErrors errors = attributeValidator.validate(request.getCommonAttributes(), CREATE_SCHEMA);
            nameValidator.validate(request.getName(), CREATE_SCHEMA + ".name", errors);
            errors.throwIfAny();

            CertificateAuthorityEntity ca = request.accept(new Creator());
            ca.setName(request.getName());
            if (ca.getSan() == null) {
                ca.setSan("");
            }
            CertificateAuthorityEntity saved = authorityRepository.save(ca);
            log.info("Created certificate authority {} ({})", saved.getName(), saved.getType());

            reloadHook.reload();
            return extender.extend(saved);
        }
    }

    public CertificateView update(Long id, CertificateUpdateRequest request) {
        try (OperationLocks.Guard guard = locks.acquire(OperationLocks.Category.CERTIFICATE_UPDATE)) {
            CertificateAuthorityEntity ca = find(id);
            String name = request.getName();
            if (name != null && !name.equals(ca.getName())) {
                nameValidator.validate(name, UPDATE_SCHEMA + ".name", new ValidationErrors()).throwIfAny();
                ca.setName(name);
                ca = authorityRepository.save(ca);
                reloadHook.reload();
            }
            return extender.extend(ca);
        }
    }

    public void delete(Long id) {
        try (OperationLocks.Guard guard = locks.acquire(OperationLocks.Category.CERTIFICATE_DELETE)) {
            CertificateAuthorityEntity ca = find(id);
            authorityRepository.delete(ca);
            log.info("Deleted certificate authority {}", ca.getName());
            reloadHook.reload();
        }
    }

    /**
     * Signs the CSR of a stored certificate with a CA and stores the result as a new certificate.
     * Returns only once that certificate has been created; its failures are this call's failures.
     */
    public CertificateView signCsr(CaSignCsrRequest request) {
        ValidationErrors errors = new ValidationErrors();
        CertificateAuthorityEntity ca = null;
        CertificateEntity csrHolder = null;
        PKCS10CertificationRequest csr = null;

        if (request.getCaId() == null) {
            errors.add(SIGN_SCHEMA + ".ca_id", "This field is required");
        } else {
            ca = authorityRepository.findById(request.getCaId()).orElse(null);
            if (ca == null) {
                errors.add(SIGN_SCHEMA + ".ca_id", "No Certificate Authority found for id " + request.getCaId());
            } else if (!CommonAttributeValidator.hasCertificateAndKey(ca)) {
                errors.add(SIGN_SCHEMA + ".ca_id", "Please use a CA which has a private key assigned");
            }
        }

        if (request.getCsrCertId() == null) {
            errors.add(SIGN_SCHEMA + ".csr_cert_id", "This field is required");
        } else {
            csrHolder = certificateRepository.findById(request.getCsrCertId()).orElse(null);
            if (csrHolder == null) {
                errors.add(SIGN_SCHEMA + ".csr_cert_id", "No Certificate found for id " + request.getCsrCertId());
            } else if (csrHolder.getCsr() == null || csrHolder.getCsr().isEmpty()) {
                errors.add(SIGN_SCHEMA + ".csr_cert_id", "No CSR has been filed by this certificate");
            } else {
                try {
                    csr = PemCodec.parseCsr(csrHolder.getCsr());
                } catch (CertificateManagementException e) {
                    errors.add(SIGN_SCHEMA + ".csr_cert_id", "CSR not valid");
                }
            }
        }
        errors.throwIfAny();

        // the serial must stay free until the signed certificate is stored
        try (OperationLocks.Guard guard = locks.acquire(OperationLocks.Category.CERTIFICATE_CREATE)) {
            X509Certificate caCertificate = PemCodec.parseCertificate(ca.getCertificate());
            PrivateKey caKey = PemCodec.parsePrivateKey(ca.getPrivateKey());
            X509Certificate signed = CertificateBuilder
                    .forSubject(csr.getSubject(), CsrFactory.publicKeyOf(csr))
                    .issuedBy(SubjectCodec.subjectOf(caCertificate), caKey)
                    .serial(serialAllocator.nextSerial(ca.getId()))
                    .lifetimeDays(SIGNED_CSR_LIFETIME_DAYS)
                    .digest(DigestAlgorithm.parse(ca.getDigestAlgorithm(), DigestAlgorithm.SHA256))
                    .sign();

            CertificateCreateRequest.Signed create = new CertificateCreateRequest.Signed();
            create.setName(request.getName());
            create.setType(CertificateType.CERT_INTERNAL);
            create.setCertificate(PemCodec.writeCertificate(signed));
            create.setPrivateKey(csrHolder.getPrivateKey());
            create.setSignedBy(ca.getId());
            return certificateService.create(create);
        }
    }

    private CertificateAuthorityEntity find(Long id) {
        return authorityRepository.findById(id)
                .orElseThrow(() -> new RecordNotFoundException("Certificate authority", id));
    }

    private static void requireSubject(ValidationErrors errors, CaCreateRequest.Internal request) {
        Records.require(errors, CREATE_SCHEMA, "key_length", request.getKeyLength());
        Records.require(errors, CREATE_SCHEMA, "digest_algorithm", request.getDigestAlgorithm());
        Records.require(errors, CREATE_SCHEMA, "lifetime", request.getLifetime());
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

    private static CertificateAuthorityEntity fromSubject(CaCreateRequest.Internal request, CertificateType type) {
        CertificateAuthorityEntity ca = CertificateAuthorityEntity.builder()
                .type(type)
                .keyLength(request.getKeyLength())
                .digestAlgorithm(DigestAlgorithm.parse(request.getDigestAlgorithm(), DigestAlgorithm.SHA256).name())
                .lifetime(request.getLifetime())
                .build();
        Records.applySubject(ca, request.toSubjectInfo());
        return ca;
    }

    /**
     * 24 random bits, never zero.
     */
    static BigInteger randomSerial() {
        return BigInteger.valueOf(RANDOM.nextInt((1 << 24) - 1) + 1);
    }

    private final class Creator implements CaCreateRequest.Visitor<CertificateAuthorityEntity> {

        @Override
        public CertificateAuthorityEntity visitInternal(CaCreateRequest.Internal request) {
            ValidationErrors errors = new ValidationErrors();
            requireSubject(errors, request);
            errors.throwIfAny();

            KeyPair keyPair = KeyPairs.generateRsa(request.getKeyLength());
            CertificateAuthorityEntity ca = fromSubject(request, CertificateType.CA_INTERNAL);
            ca.setSerial(randomSerial());
            X509Certificate certificate = CertificateBuilder
                    .forSubject(SubjectCodec.toX500Name(request.toSubjectInfo()), keyPair.getPublic())
                    .selfSigned(keyPair.getPrivate())
                    .serial(ca.getSerial())
                    .lifetimeDays(request.getLifetime())
                    .subjectAltNames(request.getSan())
                    .certificateAuthority(null)
                    .subjectKeyIdentifier()
                    .digest(DigestAlgorithm.parse(request.getDigestAlgorithm(), DigestAlgorithm.SHA256))
                    .sign();

            ca.setCertificate(PemCodec.writeCertificate(certificate));
            ca.setPrivateKey(PemCodec.writePrivateKey(keyPair.getPrivate()));
            return ca;
        }

        @Override
        public CertificateAuthorityEntity visitIntermediate(CaCreateRequest.Intermediate request) {
            ValidationErrors errors = new ValidationErrors();
            requireSubject(errors, request);
            Records.require(errors, CREATE_SCHEMA, "signedby", request.getSignedBy());
            errors.throwIfAny();

            CertificateAuthorityEntity parent = find(request.getSignedBy());
            X509Certificate parentCertificate = PemCodec.parseCertificate(parent.getCertificate());
            PrivateKey parentKey = PemCodec.parsePrivateKey(parent.getPrivateKey());

            KeyPair keyPair = KeyPairs.generateRsa(request.getKeyLength());
            CertificateAuthorityEntity ca = fromSubject(request, CertificateType.CA_INTERMEDIATE);
            ca.setSerial(serialAllocator.nextSerial(parent.getId()));
            ca.setSignedBy(parent.getId());
            X509Certificate certificate = CertificateBuilder
                    .forSubject(SubjectCodec.toX500Name(request.toSubjectInfo()), keyPair.getPublic())
                    .issuedBy(SubjectCodec.subjectOf(parentCertificate), parentKey)
                    .serial(ca.getSerial())
                    .lifetimeDays(request.getLifetime())
                    .subjectAltNames(request.getSan())
                    .certificateAuthority(0)
                    .subjectKeyIdentifier()
                    .digest(DigestAlgorithm.parse(request.getDigestAlgorithm(), DigestAlgorithm.SHA256))
                    .sign();

            ca.setCertificate(PemCodec.writeCertificate(certificate));
            ca.setPrivateKey(PemCodec.writePrivateKey(keyPair.getPrivate()));
            return ca;
        }

        @Override
        public CertificateAuthorityEntity visitImported(CaCreateRequest.Imported request) {
            ValidationErrors errors = new ValidationErrors();
            Records.require(errors, CREATE_SCHEMA, "certificate", request.getCertificate());
            errors.throwIfAny();

            String privateKey = null;
            if (request.getPrivateKey() != null && !request.getPrivateKey().isEmpty()) {
                privateKey = request.getPassphrase() == null || request.getPassphrase().isEmpty()
                        ? PemCodec.normalizePrivateKey(request.getPrivateKey())
                        : PemCodec.writePrivateKey(PemCodec.parsePrivateKey(request.getPrivateKey(),
                        request.getPassphrase()));
            }
            CertificateAuthorityEntity ca = CertificateAuthorityEntity.builder()
                    .type(CertificateType.CA_EXISTING)
                    .certificate(request.getCertificate())
                    .privateKey(privateKey)
                    .chain(PemCodec.isChain(request.getCertificate()))
                    .build();
            Records.applyCertificateInfo(ca, SubjectCodec.describe(PemCodec.parseCertificate(request.getCertificate())));
            return ca;
        }
    }
}
