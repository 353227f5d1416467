package com.certmanager.service;

import com.certmanager.TestCertificates;
import com.certmanager.crypto.PemCodec;
import com.certmanager.entity.CertificateType;
import com.certmanager.exception.ValidationException;
import com.certmanager.model.CaCreateRequest;
import com.certmanager.model.CaSignCsrRequest;
import com.certmanager.model.CertificateCreateRequest;
import com.certmanager.model.CertificateUpdateRequest;
import com.certmanager.model.CertificateView;
import com.certmanager.model.Issuer;
import com.certmanager.repository.CertificateRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigInteger;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
class CertificateAuthorityServiceTest {

    @Autowired
    private CertificateAuthorityService authorityService;

    @Autowired
    private CertificateService certificateService;

    @Autowired
    private CertificateRepository certificateRepository;

    @Autowired
    private SystemSettingsService settingsService;

    @Autowired
    private OperationLocks locks;

    @Test
    void testHierarchySharesOneSerialSequence() throws Exception {
        CertificateView root = authorityService.create(rootRequest("serial_root"));
        CaCreateRequest.Intermediate intermediateRequest = new CaCreateRequest.Intermediate();
        fillSubject(intermediateRequest, "serial_intermediate", "Intermediate CA");
        intermediateRequest.setSignedBy(root.getId());
        CertificateView intermediate = authorityService.create(intermediateRequest);

        CertificateCreateRequest.Internal leafRequest = leafRequest("serial_leaf", "www.example.com");
        leafRequest.setSignedBy(intermediate.getId());
        CertificateView leaf = certificateService.create(leafRequest);

        assertEquals(root.getSerial().add(BigInteger.ONE), intermediate.getSerial());
        assertEquals(intermediate.getSerial().add(BigInteger.ONE), leaf.getSerial());
        assertEquals(CertificateType.CA_INTERMEDIATE, intermediate.getType());
        assertEquals(CertificateType.CERT_INTERNAL, leaf.getType());

        assertEquals(3, leaf.getChainList().size());
        assertEquals("serial_intermediate", leaf.getIssuer().getAuthority().getName());
        assertEquals(Issuer.selfSigned(), leaf.getIssuer().getAuthority().getIssuer().getAuthority().getIssuer());

        X509Certificate intermediateCertificate = PemCodec.parseCertificate(intermediate.getCertificate());
        assertEquals(0, intermediateCertificate.getBasicConstraints());
        PemCodec.parseCertificate(leaf.getCertificate()).verify(intermediateCertificate.getPublicKey());
        assertEquals(Collections.singletonList("www.example.com"), leaf.getSan());
    }

    @Test
    void testRootSerialIsRandomAndPositive() {
        CertificateView root = authorityService.create(rootRequest("random_root"));

        assertTrue(root.getSerial().signum() > 0);
        assertTrue(root.getSerial().bitLength() <= 24);
        assertEquals(Issuer.selfSigned(), root.getIssuer());
        assertEquals(Integer.MAX_VALUE, PemCodec.parseCertificate(root.getCertificate()).getBasicConstraints());
    }

    @Test
    void testSignCsrCreatesInternalCertificate() {
        CertificateView root = authorityService.create(rootRequest("signing_root"));
        CertificateView csr = certificateService.create(csrRequest("pending_csr", "csr.example.com"));
        assertEquals(Issuer.signaturePending(), csr.getIssuer());

        CertificateView signed = authorityService.signCsr(new CaSignCsrRequest(root.getId(), csr.getId(), "signed_csr"));

        assertEquals(CertificateType.CERT_INTERNAL, signed.getType());
        assertEquals(root.getId(), signed.getSignedBy());
        assertEquals("signing_root", signed.getIssuer().getAuthority().getName());
        assertEquals(csr.getPrivateKey(), signed.getPrivateKey());
        assertTrue(signed.getDn().contains("CN=csr.example.com"));
        long days = Duration.between(signed.getFrom(), signed.getUntil()).toDays();
        assertEquals(CertificateAuthorityService.SIGNED_CSR_LIFETIME_DAYS, days);
        assertEquals(root.getSerial().add(BigInteger.ONE), signed.getSerial());
    }

    @Test
    void testSignCsrWaitsForRunningCreationBeforeTakingSerial() throws Exception {
        CertificateView root = authorityService.create(rootRequest("busy_root"));
        CertificateView csr = certificateService.create(csrRequest("busy_csr", "busy.example.com"));
        AtomicReference<CertificateView> signed = new AtomicReference<>();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread signer = new Thread(() -> {
            try {
                signed.set(authorityService.signCsr(new CaSignCsrRequest(root.getId(), csr.getId(), "busy_signed")));
            } catch (Throwable t) {
                failure.set(t);
            }
        });

        CertificateView leaf;
        try (OperationLocks.Guard guard = locks.acquire(OperationLocks.Category.CERTIFICATE_CREATE)) {
            signer.start();
            long deadline = System.currentTimeMillis() + 5000;
            while (signer.getState() != Thread.State.WAITING && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            CertificateCreateRequest.Internal leafRequest = leafRequest("busy_leaf", "leaf.example.com");
            leafRequest.setSignedBy(root.getId());
            leaf = certificateService.create(leafRequest);
        }
        signer.join(10000);

        assertNull(failure.get());
        assertNotNull(signed.get());
        assertNotEquals(leaf.getSerial(), signed.get().getSerial());
        assertEquals(leaf.getSerial().add(BigInteger.ONE), signed.get().getSerial());
    }

    @Test
    void testSignCsrReportsEveryProblemAtOnce() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> authorityService.signCsr(new CaSignCsrRequest(987654L, 876543L, "nothing")));

        assertTrue(e.getErrors().contains("ca_sign_csr.ca_id"));
        assertTrue(e.getErrors().contains("ca_sign_csr.csr_cert_id"));
    }

    @Test
    void testCreateValidationIsBatchedAndStoresNothing() {
        CaCreateRequest.Internal request = rootRequest("bad name");
        request.setCountry("XX");
        request.setKeyLength(1000);
        long before = authorityService.query().size();

        ValidationException e = assertThrows(ValidationException.class, () -> authorityService.create(request));

        assertEquals(3, e.getErrors().getErrors().size());
        assertEquals(before, authorityService.query().size());
    }

    @Test
    void testImportedCaWithEncryptedKey() {
        X509Certificate ca = TestCertificates.selfSignedCa("Imported Root", 31337);
        CaCreateRequest.Imported request = new CaCreateRequest.Imported();
        request.setName("imported_root");
        request.setCertificate(TestCertificates.pem(ca));
        request.setPrivateKey(PemCodec.writePrivateKey(TestCertificates.ROOT_KEY.getPrivate(), "secret"));
        request.setPassphrase("secret");

        CertificateView imported = authorityService.create(request);

        assertEquals(CertificateType.CA_EXISTING, imported.getType());
        assertEquals(Issuer.external(), imported.getIssuer());
        assertEquals(BigInteger.valueOf(31337), imported.getSerial());
        assertEquals("Imported Root", imported.getCommon());
        assertFalse(imported.getPrivateKey().contains("ENCRYPTED"));
    }

    @Test
    void testRenameIsValidated() {
        CertificateView root = authorityService.create(rootRequest("rename_me"));
        CertificateUpdateRequest update = new CertificateUpdateRequest();
        update.setName("external");

        assertThrows(ValidationException.class, () -> authorityService.update(root.getId(), update));

        update.setName("renamed_root");
        assertEquals("renamed_root", authorityService.update(root.getId(), update).getName());
    }

    @Test
    void testDefaultServingCertificateIsProvisioned() {
        Long id = settingsService.getUiCertificateId();

        assertNotNull(id);
        assertEquals("system_default", certificateRepository.findById(id).get().getName());
    }

    private static CertificateCreateRequest.Internal leafRequest(String name, String common) {
        CertificateCreateRequest.Internal request = new CertificateCreateRequest.Internal();
        request.setName(name);
        request.setKeyLength(2048);
        request.setDigestAlgorithm("SHA256");
        request.setLifetime(397);
        request.setCountry("US");
        request.setState("Tennessee");
        request.setCity("Maryville");
        request.setOrganization("Test Org");
        request.setCommon(common);
        request.setEmail("admin@example.com");
        request.setSan(Collections.singletonList(common));
        return request;
    }

    private static CertificateCreateRequest.Csr csrRequest(String name, String common) {
        CertificateCreateRequest.Csr request = new CertificateCreateRequest.Csr();
        request.setName(name);
        request.setKeyLength(2048);
        request.setDigestAlgorithm("SHA256");
        request.setCountry("US");
        request.setState("Tennessee");
        request.setCity("Maryville");
        request.setOrganization("Test Org");
        request.setCommon(common);
        request.setEmail("admin@example.com");
        return request;
    }

    private static CaCreateRequest.Internal rootRequest(String name) {
        CaCreateRequest.Internal request = new CaCreateRequest.Internal();
        fillSubject(request, name, "Root CA " + name);
        return request;
    }

    private static void fillSubject(CaCreateRequest.Internal request, String name, String common) {
        request.setName(name);
        request.setKeyLength(2048);
        request.setDigestAlgorithm("SHA256");
        request.setLifetime(3650);
        request.setCountry("US");
        request.setState("Tennessee");
        request.setCity("Maryville");
        request.setOrganization("Test Org");
        request.setCommon(common);
        request.setEmail("ca@example.com");
    }
}
