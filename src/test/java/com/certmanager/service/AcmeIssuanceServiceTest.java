package com.certmanager.service;

import com.certmanager.TestCertificates;
import com.certmanager.acme.AcmeAccount;
import com.certmanager.acme.AcmeAuthorization;
import com.certmanager.acme.AcmeClient;
import com.certmanager.acme.AcmeDnsChallenge;
import com.certmanager.acme.AcmeOrder;
import com.certmanager.acme.OrderStatus;
import com.certmanager.config.AcmeConfig;
import com.certmanager.crypto.PemCodec;
import com.certmanager.entity.AcmeRegistrationEntity;
import com.certmanager.entity.CertificateEntity;
import com.certmanager.entity.CertificateType;
import com.certmanager.exception.AcmeProtocolException;
import com.certmanager.exception.AcmeTimeoutException;
import com.certmanager.exception.RecordNotFoundException;
import com.certmanager.exception.ValidationErrors;
import com.certmanager.exception.ValidationException;
import com.certmanager.model.IssuedCertificate;
import com.certmanager.model.RenewalReport;
import com.certmanager.repository.CertificateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AcmeIssuanceServiceTest {

    private static final String DIRECTORY = "https://acme.example.test/directory/";

    @Mock
    private AcmeClient acmeClient;

    @Mock
    private AcmeRegistrationService registrationService;

    @Mock
    private DnsAuthenticatorService dnsAuthenticatorService;

    @Mock
    private CertificateRepository certificateRepository;

    @Mock
    private ServiceReloadHook reloadHook;

    @Mock
    private AcmeConfig acmeConfig;

    @Spy
    private OperationLocks locks = new OperationLocks();

    @InjectMocks
    private AcmeIssuanceService service;

    private final AcmeAccount account = new AcmeAccount(DIRECTORY, "https://acme.example.test/acct/1",
            TestCertificates.ROOT_KEY);

    @BeforeEach
    void setUp() {
        lenient().when(acmeConfig.getFinalizeTimeout()).thenReturn(Duration.ofSeconds(5));
        lenient().when(acmeConfig.getPollInterval()).thenReturn(Duration.ZERO);
    }

    @Test
    void testUnmappedDomainIsReportedBeforeContactingTheServer() {
        CertificateEntity csr = csrRecord("a.example.com", "a.example.com", "b.example.com");
        Map<String, Long> mapping = new LinkedHashMap<>();
        mapping.put("a.example.com", 1L);
        when(dnsAuthenticatorService.exists(1L)).thenReturn(true);

        ValidationException e = assertThrows(ValidationException.class, () -> service.issue(DIRECTORY, true,
                mapping, csr, JobProgress.logging("test"), 25));

        assertEquals(1, e.getErrors().getErrors().size());
        assertEquals("acme_create.dns_mapping", e.getErrors().getErrors().get(0).getField());
        assertTrue(e.getErrors().getErrors().get(0).getMessage().contains("b.example.com"));
        verifyNoInteractions(acmeClient);
        verify(registrationService, never()).resolve(anyString(), anyBoolean());
    }

    @Test
    void testWildcardOrderIsAuthorizedAndFinalized() throws Exception {
        CertificateEntity csr = csrRecord("example.com", "example.com", "*.example.com");
        Map<String, Long> mapping = new LinkedHashMap<>();
        mapping.put("example.com", 7L);
        mapping.put("*.example.com", 7L);
        when(dnsAuthenticatorService.exists(7L)).thenReturn(true);
        when(registrationService.resolve(DIRECTORY, true)).thenReturn(account);

        FakeChallenge plain = new FakeChallenge("digest-plain");
        FakeChallenge wildcard = new FakeChallenge("digest-wildcard");
        String chain = chainPem();
        FakeOrder order = new FakeOrder(chain, Arrays.asList(
                new FakeAuthorization("example.com", false, false, plain),
                new FakeAuthorization("example.com", true, false, wildcard)),
                OrderStatus.PENDING, OrderStatus.READY, OrderStatus.PROCESSING, OrderStatus.VALID);
        when(acmeClient.newOrder(account, Arrays.asList("example.com", "*.example.com"))).thenReturn(order);

        IssuedCertificate issued = service.issue(DIRECTORY, true, mapping, csr, JobProgress.logging("test"), 25);

        assertEquals(chain, issued.getFullChainPem());
        assertEquals(order.getLocation(), issued.getOrderUri());
        assertTrue(issued.isChain());
        assertTrue(plain.triggered);
        assertTrue(wildcard.triggered);
        verify(dnsAuthenticatorService).updateTxtRecord(7L, "example.com", "digest-plain");
        verify(dnsAuthenticatorService).updateTxtRecord(7L, "example.com", "digest-wildcard");
        assertArrayEquals(PemCodec.parseCsr(csr.getCsr()).getEncoded(), order.finalizedWith);
    }

    @Test
    void testAlreadyValidAuthorizationIsSkipped() {
        FakeChallenge challenge = new FakeChallenge("unused");
        FakeOrder order = new FakeOrder(null, Collections.singletonList(
                new FakeAuthorization("example.com", false, true, challenge)));

        service.handleAuthorizations(order, Collections.singletonMap("example.com", 1L),
                JobProgress.logging("test"), 25);

        assertFalse(challenge.triggered);
        verifyNoInteractions(dnsAuthenticatorService);
    }

    @Test
    void testMissingDnsChallengeFailsTheOrder() {
        FakeOrder order = new FakeOrder(null, Collections.singletonList(
                new FakeAuthorization("example.com", false, false, null)));
        JobProgress progress = JobProgress.logging("test");

        AcmeProtocolException e = assertThrows(AcmeProtocolException.class, () -> service.handleAuthorizations(
                order, Collections.singletonMap("example.com", 1L), progress, 25));

        assertEquals("DNS Challenge not found for domain example.com", e.getMessage());
        assertEquals("DNS challenge failed for example.com", progress.getMessage());
    }

    @Test
    void testFinalizationTimesOut() {
        when(acmeConfig.getFinalizeTimeout()).thenReturn(Duration.ofMillis(50));
        when(acmeConfig.getPollInterval()).thenReturn(Duration.ofMillis(10));
        FakeOrder order = new FakeOrder(null, Collections.emptyList(), OrderStatus.PENDING);

        assertThrows(AcmeTimeoutException.class, () -> service.finalizeOrder(order, new byte[0]));
    }

    @Test
    void testInvalidOrderFails() {
        FakeOrder order = new FakeOrder(null, Collections.emptyList(), OrderStatus.READY, OrderStatus.INVALID);

        assertThrows(AcmeProtocolException.class, () -> service.finalizeOrder(order, new byte[] {1}));
        assertArrayEquals(new byte[] {1}, order.finalizedWith);
    }

    @Test
    void testDomainRules() {
        lenient().when(dnsAuthenticatorService.exists(anyLong())).thenReturn(true);
        Map<String, Long> mapping = new LinkedHashMap<>();
        mapping.put("bad.", 1L);
        mapping.put("a.*.example.com", 1L);
        mapping.put("bücher.example", 1L);
        mapping.put("extra.example.com", 1L);

        ValidationErrors errors = new ValidationErrors();
        service.validateDomains(Arrays.asList("bad.", "a.*.example.com", "bücher.example"), mapping, errors);

        List<String> messages = new ArrayList<>();
        errors.getErrors().forEach(error -> messages.add(error.getMessage()));
        assertTrue(messages.contains("Domain bad. name cannot end with a period"));
        assertTrue(messages.contains("Wildcards must be at the start of domain name followed by a period"));
        assertTrue(messages.contains("Domain bücher.example must be an ASCII domain name"));
        assertTrue(messages.contains("extra.example.com not specified in the CSR"));
        assertEquals(4, messages.size());
    }

    @Test
    void testRenewalFailureDoesNotStopTheSweep() {
        X509Certificate root = TestCertificates.selfSignedCa("Root", 1);
        CertificateEntity broken = acmeCertificate("broken", 1L, "broken.example.com",
                TestCertificates.leaf("broken.example.com", root, 2, 2));
        CertificateEntity healthy = acmeCertificate("healthy", 2L, "healthy.example.com",
                TestCertificates.leaf("healthy.example.com", root, 3, 2));
        CertificateEntity fresh = acmeCertificate("fresh", 2L, "fresh.example.com",
                TestCertificates.leaf("fresh.example.com", root, 4, 300));
        when(certificateRepository.findByAcmeRegistrationIdIsNotNull())
                .thenReturn(Arrays.asList(broken, healthy, fresh));
        when(registrationService.get(1L)).thenThrow(new RecordNotFoundException("ACME registration", 1L));
        when(registrationService.get(2L)).thenReturn(AcmeRegistrationEntity.builder()
                .id(2L)
                .directory(DIRECTORY)
                .build());
        when(dnsAuthenticatorService.exists(3L)).thenReturn(true);
        when(registrationService.resolve(DIRECTORY, true)).thenReturn(account);
        String chain = chainPem();
        when(acmeClient.newOrder(account, Collections.singletonList("healthy.example.com")))
                .thenReturn(new FakeOrder(chain, Collections.emptyList(), OrderStatus.VALID));

        RenewalReport report = service.renew();

        assertEquals(Collections.singletonList("healthy"), report.getRenewed());
        assertEquals(Collections.singleton("broken"), report.getFailures().keySet());
        assertEquals(2, report.getAttempted());
        assertEquals(chain, healthy.getCertificate());
        assertTrue(healthy.isChain());
        verify(certificateRepository, times(1)).save(healthy);
        verify(reloadHook).reload();
    }

    @Test
    void testSweepIsSkippedWhileAnotherIsRunning() {
        doReturn(Optional.empty()).when(locks).tryAcquire(OperationLocks.Category.ACME_RENEWAL);

        RenewalReport report = service.renew();

        assertTrue(report.isSkipped());
        verifyNoInteractions(certificateRepository);
    }

    private static CertificateEntity csrRecord(String common, String... san) {
        return CertificateEntity.builder()
                .name("csr")
                .type(CertificateType.CERT_CSR)
                .csr(TestCertificates.csrPem(common, Arrays.asList(san)))
                .build();
    }

    private static CertificateEntity acmeCertificate(String name, Long registration, String domain,
                                                     X509Certificate certificate) {
        return CertificateEntity.builder()
                .name(name)
                .type(CertificateType.CERT_EXISTING)
                .certificate(TestCertificates.pem(certificate))
                .csr(TestCertificates.csrPem(domain, Collections.singletonList(domain)))
                .acmeRegistrationId(registration)
                .domainsAuthenticators(new LinkedHashMap<>(Collections.singletonMap(domain, 3L)))
                .renewDays(10)
                .build();
    }

    private static String chainPem() {
        X509Certificate root = TestCertificates.selfSignedCa("Issuer", 1);
        return TestCertificates.pem(TestCertificates.leaf("issued.example.com", root, 9, 90))
                + TestCertificates.pem(root);
    }

    private static final class FakeOrder implements AcmeOrder {
        private final String chain;
        private final List<AcmeAuthorization> authorizations;
        private final Deque<OrderStatus> statuses;
        private OrderStatus last = OrderStatus.PENDING;
        private byte[] finalizedWith;

        private FakeOrder(String chain, List<AcmeAuthorization> authorizations, OrderStatus... statuses) {
            this.chain = chain;
            this.authorizations = authorizations;
            this.statuses = new ArrayDeque<>(Arrays.asList(statuses));
        }

        @Override
        public String getLocation() {
            return "https://acme.example.test/order/1";
        }

        @Override
        public List<AcmeAuthorization> getAuthorizations() {
            return authorizations;
        }

        @Override
        public OrderStatus refresh() {
            if (!statuses.isEmpty()) {
                last = statuses.poll();
            }
            return last;
        }

        @Override
        public void finalizeOrder(byte[] csr) {
            finalizedWith = csr;
        }

        @Override
        public String downloadCertificateChain() {
            return chain;
        }
    }

    private static final class FakeAuthorization implements AcmeAuthorization {
        private final String domain;
        private final boolean wildcard;
        private final boolean valid;
        private final AcmeDnsChallenge challenge;

        private FakeAuthorization(String domain, boolean wildcard, boolean valid, AcmeDnsChallenge challenge) {
            this.domain = domain;
            this.wildcard = wildcard;
            this.valid = valid;
            this.challenge = challenge;
        }

        @Override
        public String getDomain() {
            return domain;
        }

        @Override
        public boolean isWildcard() {
            return wildcard;
        }

        @Override
        public boolean isValid() {
            return valid;
        }

        @Override
        public AcmeDnsChallenge findDnsChallenge() {
            return challenge;
        }
    }

    private static final class FakeChallenge implements AcmeDnsChallenge {
        private final String digest;
        private boolean triggered;

        private FakeChallenge(String digest) {
            this.digest = digest;
        }

        @Override
        public String getDigest() {
            return digest;
        }

        @Override
        public void trigger() {
            triggered = true;
        }
    }
}
