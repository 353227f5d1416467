package com.certmanager.service;

import com.certmanager.acme.AcmeAccount;
import com.certmanager.acme.AcmeAuthorization;
import com.certmanager.acme.AcmeClient;
import com.certmanager.acme.AcmeDnsChallenge;
import com.certmanager.acme.AcmeOrder;
import com.certmanager.acme.OrderStatus;
import com.certmanager.config.AcmeConfig;
import com.certmanager.crypto.PemCodec;
import com.certmanager.crypto.SubjectCodec;
import com.certmanager.crypto.SubjectInfo;
import com.certmanager.entity.AcmeRegistrationEntity;
import com.certmanager.entity.CertificateEntity;
import com.certmanager.entity.CertificateRecord;
import com.certmanager.exception.AcmeProtocolException;
import com.certmanager.exception.AcmeTimeoutException;
import com.certmanager.exception.CertificateManagementException;
import com.certmanager.exception.ValidationErrors;
import com.certmanager.model.IssuedCertificate;
import com.certmanager.model.RenewalReport;
import com.certmanager.repository.CertificateRepository;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

@Slf4j
@Service
public class AcmeIssuanceService {

    static final String MAPPING_FIELD = "acme_create.dns_mapping";

    private static final Pattern ASCII_DOMAIN = Pattern.compile("^[\\x21-\\x7E]+$");

    @Autowired
    private AcmeClient acmeClient;

    @Autowired
    private AcmeRegistrationService registrationService;

    @Autowired
    private DnsAuthenticatorService dnsAuthenticatorService;

    @Autowired
    private CertificateRepository certificateRepository;

    @Autowired
    private OperationLocks locks;

    @Autowired
    private ServiceReloadHook reloadHook;

    @Autowired
    private AcmeConfig acmeConfig;

    /**
     * Common name followed by the subject alternative names of the CSR, without duplicates.
     */
    public List<String> domainNames(String csrPem) {
        SubjectInfo subject = SubjectCodec.describe(PemCodec.parseCsr(csrPem));
        List<String> domains = new ArrayList<>();
        if (subject.getCommon() != null) {
            domains.add(subject.getCommon());
        }
        for (String san : subject.getSan()) {
            if (!domains.contains(san)) {
                domains.add(san);
            }
        }
        return domains;
    }

    /**
     * Checks every domain of the CSR against the DNS mapping. Findings are added to {@code errors}.
     */
    public void validateDomains(List<String> domains, Map<String, Long> dnsMapping, ValidationErrors errors) {
        Map<String, Long> mapping = dnsMapping == null ? new LinkedHashMap<>() : dnsMapping;
        for (String domain : domains) {
            if (!mapping.containsKey(domain)) {
                errors.add(MAPPING_FIELD, "Please provide DNS authenticator id for " + domain);
            } else if (!dnsAuthenticatorService.exists(mapping.get(domain))) {
                errors.add(MAPPING_FIELD, "Provided DNS Authenticator id for " + domain + " does not exist");
            }
            if (!ASCII_DOMAIN.matcher(domain).matches()) {
                errors.add(MAPPING_FIELD, "Domain " + domain + " must be an ASCII domain name");
            }
            if (domain.endsWith(".")) {
                errors.add(MAPPING_FIELD, "Domain " + domain + " name cannot end with a period");
            }
            if (domain.contains("*") && !(domain.startsWith("*.") && domain.indexOf('*', 1) < 0)) {
                errors.add(MAPPING_FIELD, "Wildcards must be at the start of domain name followed by a period");
            }
        }
        for (String domain : mapping.keySet()) {
            if (!domains.contains(domain)) {
                errors.add(MAPPING_FIELD, domain + " not specified in the CSR");
            }
        }
    }

    /**
     * Runs one issuance attempt for the CSR held by {@code csrRecord}.
     *
     * @param progressBase percentage already reported when issuance starts
     */
    public IssuedCertificate issue(String directoryUri, boolean tos, Map<String, Long> dnsMapping,
                                   CertificateRecord csrRecord, JobProgress progress, double progressBase) {
        List<String> domains = domainNames(csrRecord.getCsr());
        ValidationErrors errors = new ValidationErrors();
        validateDomains(domains, dnsMapping, errors);
        if (!tos && !registrationService.findByDirectory(directoryUri).isPresent()) {
            errors.add("acme_create.tos", "Please agree to the terms of service");
        }
        errors.throwIfAny();

        AcmeAccount account = registrationService.resolve(directoryUri, tos);
        AcmeOrder order = acmeClient.newOrder(account, domains);
        progress.update(progressBase, "New order for certificate issuance placed");

        handleAuthorizations(order, dnsMapping, progress, progressBase);

        String fullChain = finalizeOrder(order, csrDer(csrRecord));
        return IssuedCertificate.builder()
                .fullChainPem(fullChain)
                .orderUri(order.getLocation())
                .build();
    }

    void handleAuthorizations(AcmeOrder order, Map<String, Long> dnsMapping, JobProgress progress,
                              double progressBase) {
        Map<String, Long> byDomain = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : dnsMapping.entrySet()) {
            byDomain.put(entry.getKey().startsWith("*.") ? entry.getKey().substring(2) : entry.getKey(),
                    entry.getValue());
        }

        List<AcmeAuthorization> authorizations = order.getAuthorizations();
        // authorizations advance progress from progressBase up to three times progressBase
        double span = progressBase * 2;
        double step = authorizations.isEmpty() ? 0 : span / authorizations.size();
        double current = progressBase;
        for (AcmeAuthorization authorization : authorizations) {
            String domain = authorization.getDomain();
            boolean completed = false;
            current += step;
            try {
                if (authorization.isValid()) {
                    completed = true;
                    continue;
                }
                AcmeDnsChallenge challenge = authorization.findDnsChallenge();
                if (challenge == null) {
                    throw new AcmeProtocolException("DNS Challenge not found for domain " + domain);
                }
                Long authenticatorId = byDomain.get(domain);
                if (authenticatorId == null) {
                    throw new AcmeProtocolException("No DNS authenticator assigned to " + domain);
                }
                dnsAuthenticatorService.updateTxtRecord(authenticatorId, domain, challenge.getDigest());
                challenge.trigger();
                completed = true;
            } finally {
                progress.update(current, "DNS challenge " + (completed ? "completed" : "failed") + " for " + domain);
            }
        }
    }

    /**
     * Polls the order, finalizes it with the CSR once ready and returns the issued chain.
     */
    String finalizeOrder(AcmeOrder order, byte[] csr) {
        Instant deadline = Instant.now().plus(acmeConfig.getFinalizeTimeout());
        boolean finalized = false;
        while (true) {
            OrderStatus status = order.refresh();
            if (status == OrderStatus.VALID) {
                return order.downloadCertificateChain();
            }
            if (status == OrderStatus.INVALID) {
                throw new AcmeProtocolException("Order " + order.getLocation() + " is invalid");
            }
            if (status == OrderStatus.READY && !finalized) {
                order.finalizeOrder(csr);
                finalized = true;
                continue;
            }
            if (!Instant.now().isBefore(deadline)) {
                throw new AcmeTimeoutException("Certificate request for final order timed out");
            }
            sleep(acmeConfig.getPollInterval());
        }
    }

    public void revoke(CertificateEntity certificate) {
        AcmeRegistrationEntity registration = registrationService.get(certificate.getAcmeRegistrationId());
        X509Certificate x509 = PemCodec.parseCertificate(certificate.getCertificate());
        acmeClient.revoke(registrationService.toAccount(registration), x509);
    }

    @Scheduled(initialDelayString = "${pki.renewal.initial-delay:PT0S}",
            fixedDelayString = "${pki.renewal.interval:PT24H}")
    public void renewCertificates() {
        RenewalReport report = renew();
        if (!report.getFailures().isEmpty()) {
            log.warn("Certificate renewal finished with failures: {}", report.getFailures());
        }
    }

    /**
     * Renews every ACME certificate with fewer whole days left than its {@code renew_days}. A
     * failing certificate is recorded in the report and the sweep goes on with the next one.
     */
    public RenewalReport renew() {
        Optional<OperationLocks.Guard> acquired = locks.tryAcquire(OperationLocks.Category.ACME_RENEWAL);
        if (!acquired.isPresent()) {
            log.info("Certificate renewal already running, skipping");
            return RenewalReport.skippedSweep();
        }
        try (OperationLocks.Guard guard = acquired.get()) {
            RenewalReport report = new RenewalReport();
            List<CertificateEntity> certificates = certificateRepository.findByAcmeRegistrationIdIsNotNull();
            JobProgress progress = JobProgress.logging("acme_cert_renewal");
            double percent = 0;
            for (CertificateEntity certificate : certificates) {
                percent += 100.0 / certificates.size();
                try {
                    if (isDue(certificate)) {
                        log.debug("Renewing certificate {}", certificate.getName());
                        renewOne(certificate, progress, percent / 4);
                        report.renewed(certificate.getName());
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to renew certificate {}: {}", certificate.getName(), e.getMessage(), e);
                    report.failed(certificate.getName(), e.getMessage());
                }
                progress.update(percent);
            }
            if (!report.getRenewed().isEmpty()) {
                reloadHook.reload();
            }
            return report;
        }
    }

    boolean isDue(CertificateEntity certificate) {
        X509Certificate x509 = PemCodec.parseCertificate(certificate.getCertificate());
        long daysLeft = Duration.between(Instant.now(), x509.getNotAfter().toInstant()).toDays();
        int renewDays = certificate.getRenewDays() == null ? 10 : certificate.getRenewDays();
        return daysLeft < renewDays;
    }

    private void renewOne(CertificateEntity certificate, JobProgress progress, double progressBase) {
        AcmeRegistrationEntity registration = registrationService.get(certificate.getAcmeRegistrationId());
        Map<String, Long> mapping = certificate.getDomainsAuthenticators() == null
                ? new LinkedHashMap<>() : certificate.getDomainsAuthenticators();
        IssuedCertificate issued = issue(registration.getDirectory(), true, mapping, certificate, progress,
                progressBase);

        certificate.setCertificate(issued.getFullChainPem());
        certificate.setAcmeUri(issued.getOrderUri());
        certificate.setChain(issued.isChain());
        certificateRepository.save(certificate);
        log.info("Renewed certificate {}", certificate.getName());
    }

    private static byte[] csrDer(CertificateRecord csrRecord) {
        PKCS10CertificationRequest csr = PemCodec.parseCsr(csrRecord.getCsr());
        try {
            return csr.getEncoded();
        } catch (IOException e) {
            throw new CertificateManagementException("Unable to encode CSR of " + csrRecord.getName(), e);
        }
    }

    private static void sleep(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcmeProtocolException("Interrupted while waiting for the ACME order", e);
        }
    }
}
