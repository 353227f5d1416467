package com.certmanager.service;

import com.certmanager.crypto.Fingerprints;
import com.certmanager.crypto.PemCodec;
import com.certmanager.crypto.SubjectCodec;
import com.certmanager.entity.CertificateAuthorityEntity;
import com.certmanager.entity.CertificateEntity;
import com.certmanager.entity.CertificateRecord;
import com.certmanager.entity.CertificateType;
import com.certmanager.exception.CertificateManagementException;
import com.certmanager.model.CertificateView;
import com.certmanager.model.Issuer;
import com.certmanager.repository.CertificateAuthorityRepository;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a stored certificate or CA into its {@link CertificateView}: issuer chain, file paths,
 * validity window and re-encoded PEM material. Reads only, never writes to the store.
 */
@Slf4j
@Component
public class CertificateExtender {

    @Value("${pki.certificates.root-path:/etc/certificates}")
    private String rootPath;

    @Autowired
    private CertificateAuthorityRepository authorityRepository;

    public CertificateView extend(CertificateRecord record) {
        List<CertificateAuthorityEntity> ancestors = ancestorsOf(record);

        // views are built from the topmost ancestor down so that each one can refer to its parent
        CertificateView parent = null;
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            CertificateAuthorityEntity ca = ancestors.get(i);
            parent = buildView(ca, issuerOf(ca, parent), ancestors.subList(i + 1, ancestors.size()));
        }
        return buildView(record, issuerOf(record, parent), ancestors);
    }

    public String getRootPath() {
        return rootPath;
    }

    public String rootPathOf(CertificateType type) {
        return type.isAuthority() ? Paths.get(rootPath, "CA").toString() : rootPath;
    }

    /**
     * Signing CAs above the record, nearest first. The walk stops at a terminal issuer, at a
     * dangling reference or when a CA shows up a second time.
     */
    List<CertificateAuthorityEntity> ancestorsOf(CertificateRecord record) {
        List<CertificateAuthorityEntity> ancestors = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        if (record instanceof CertificateAuthorityEntity && record.getId() != null) {
            visited.add(record.getId());
        }
        CertificateRecord current = record;
        while (isSignedByAuthority(current.getType()) && current.getSignedBy() != null) {
            Long parentId = current.getSignedBy();
            if (!visited.add(parentId)) {
                log.warn("Signing chain of {} loops back to CA {}", record.getName(), parentId);
                break;
            }
            Optional<CertificateAuthorityEntity> parent = authorityRepository.findById(parentId);
            if (!parent.isPresent()) {
                log.debug("Signing CA {} of {} no longer exists", parentId, current.getName());
                break;
            }
            ancestors.add(parent.get());
            current = parent.get();
        }
        return ancestors;
    }

    private static boolean isSignedByAuthority(CertificateType type) {
        return type == CertificateType.CERT_INTERNAL || type == CertificateType.CA_INTERMEDIATE;
    }

    private static Issuer issuerOf(CertificateRecord record, CertificateView parent) {
        switch (record.getType()) {
            case CA_EXISTING:
            case CERT_EXISTING:
                return Issuer.external();
            case CA_INTERNAL:
                return Issuer.selfSigned();
            case CERT_CSR:
                return Issuer.signaturePending();
            case CERT_INTERNAL:
            case CA_INTERMEDIATE:
                return parent == null ? null : Issuer.signedBy(parent);
            default:
                throw new IllegalStateException("Unknown certificate type " + record.getType());
        }
    }

    private CertificateView buildView(CertificateRecord record, Issuer issuer,
                                      List<CertificateAuthorityEntity> ancestors) {
        String root = rootPathOf(record.getType());
        X509Certificate leaf = decodeCertificate(record.getName(), record.getCertificate());
        PKCS10CertificationRequest csr = decodeCsr(record.getName(), record.getCsr());

        CertificateView.CertificateViewBuilder view = CertificateView.builder()
                .id(record.getId())
                .type(record.getType())
                .name(record.getName())
                .certificate(record.getCertificate())
                .privateKey(normalizePrivateKey(record.getName(), record.getPrivateKey()))
                .csr(csr == null ? record.getCsr() : PemCodec.writeCsr(csr))
                .serial(record.getSerial())
                .signedBy(record.getSignedBy())
                .keyLength(record.getKeyLength())
                .digestAlgorithm(record.getDigestAlgorithm())
                .lifetime(record.getLifetime())
                .country(record.getCountry())
                .state(record.getState())
                .city(record.getCity())
                .organization(record.getOrganization())
                .organizationalUnit(record.getOrganizationalUnit())
                .common(record.getCommon())
                .email(record.getEmail())
                .san(splitSan(record.getSan()))
                .chain(record.isChain())
                .rootPath(root)
                .certificatePath(Paths.get(root, record.getName() + ".crt").toString())
                .privateKeyPath(Paths.get(root, record.getName() + ".key").toString())
                .csrPath(Paths.get(root, record.getName() + ".csr").toString())
                .issuer(issuer)
                .chainList(chainList(record, ancestors))
                .internal(record.getType().isExternal() ? "NO" : "YES");

        if (record.getType() == CertificateType.CERT_CSR) {
            if (csr != null) {
                view.dn(SubjectCodec.distinguishedName(csr.getSubject()));
            }
        } else if (leaf != null) {
            view.from(leaf.getNotBefore().toInstant())
                    .until(leaf.getNotAfter().toInstant())
                    .dn(SubjectCodec.distinguishedName(SubjectCodec.subjectOf(leaf)))
                    .fingerprint(Fingerprints.sha1(leaf));
        }

        if (record instanceof CertificateEntity && ((CertificateEntity) record).isAcme()) {
            CertificateEntity cert = (CertificateEntity) record;
            view.acme(cert.getAcmeRegistrationId())
                    .acmeUri(cert.getAcmeUri())
                    .domainsAuthenticators(cert.getDomainsAuthenticators())
                    .renewDays(cert.getRenewDays());
        }
        return view.build();
    }

    /**
     * Decoded certificates from the leaf outwards. Blocks that cannot be decoded are skipped.
     */
    private List<String> chainList(CertificateRecord record, List<CertificateAuthorityEntity> ancestors) {
        List<String> blobs = new ArrayList<>();
        if (record.isChain()) {
            blobs.addAll(PemCodec.splitCertificates(record.getCertificate()));
        } else {
            blobs.add(record.getCertificate());
            for (CertificateAuthorityEntity ca : ancestors) {
                blobs.add(ca.getCertificate());
            }
        }

        List<String> chain = new ArrayList<>();
        for (String blob : blobs) {
            if (blob == null || blob.trim().isEmpty()) {
                continue;
            }
            X509Certificate certificate = decodeCertificate(record.getName(), blob);
            if (certificate != null) {
                chain.add(PemCodec.writeCertificate(certificate));
            }
        }
        return chain;
    }

    static List<String> splitSan(String san) {
        if (san == null || san.trim().isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(san.trim().split("[\\s,]+")));
    }

    private static X509Certificate decodeCertificate(String name, String pem) {
        if (pem == null || pem.trim().isEmpty()) {
            return null;
        }
        try {
            return PemCodec.parseCertificate(pem);
        } catch (CertificateManagementException e) {
            log.debug("Failed to load certificate {}", name, e);
            return null;
        }
    }

    private static PKCS10CertificationRequest decodeCsr(String name, String pem) {
        if (pem == null || pem.trim().isEmpty()) {
            return null;
        }
        try {
            return PemCodec.parseCsr(pem);
        } catch (CertificateManagementException e) {
            log.debug("Failed to load CSR {}", name, e);
            return null;
        }
    }

    private static String normalizePrivateKey(String name, String pem) {
        if (pem == null || pem.trim().isEmpty()) {
            return pem;
        }
        try {
            return PemCodec.normalizePrivateKey(pem);
        } catch (CertificateManagementException e) {
            log.debug("Failed to load private key {}", name, e);
            return pem;
        }
    }
}
