package com.certmanager.service.impl;

import com.certmanager.acme.AcmeAccount;
import com.certmanager.acme.AcmeAuthorization;
import com.certmanager.acme.AcmeClient;
import com.certmanager.acme.AcmeDnsChallenge;
import com.certmanager.acme.AcmeOrder;
import com.certmanager.acme.OrderStatus;
import com.certmanager.exception.AcmeProtocolException;
import lombok.extern.slf4j.Slf4j;
import org.shredzone.acme4j.Account;
import org.shredzone.acme4j.AccountBuilder;
import org.shredzone.acme4j.Authorization;
import org.shredzone.acme4j.Certificate;
import org.shredzone.acme4j.Login;
import org.shredzone.acme4j.Order;
import org.shredzone.acme4j.RevocationReason;
import org.shredzone.acme4j.Session;
import org.shredzone.acme4j.Status;
import org.shredzone.acme4j.challenge.Dns01Challenge;
import org.shredzone.acme4j.exception.AcmeException;
import org.shredzone.acme4j.exception.AcmeRetryAfterException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringWriter;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class Acme4jClient implements AcmeClient {

    @Override
    public String termsOfService(String directoryUri) {
        try {
            URI tos = session(directoryUri).getMetadata().getTermsOfService();
            return tos == null ? null : tos.toString();
        } catch (AcmeException e) {
            throw new AcmeProtocolException("Failed to read directory " + directoryUri + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String register(String directoryUri, KeyPair accountKey) {
        log.info("Registering ACME account with {}", directoryUri);
        try {
            Account account = new AccountBuilder()
                    .agreeToTermsOfService()
                    .useKeyPair(accountKey)
                    .create(session(directoryUri));
            return account.getLocation().toString();
        } catch (AcmeException e) {
            throw new AcmeProtocolException("Failed to register ACME account: " + e.getMessage(), e);
        }
    }

    @Override
    public AcmeOrder newOrder(AcmeAccount account, List<String> domains) {
        try {
            Order order = login(account).getAccount().newOrder().domains(domains).create();
            log.info("New order {} for {}", order.getLocation(), domains);
            return new Acme4jOrder(order);
        } catch (AcmeException e) {
            throw new AcmeProtocolException("Failed to issue a new order for Certificate : " + e.getMessage(), e);
        }
    }

    @Override
    public void revoke(AcmeAccount account, X509Certificate certificate) {
        try {
            Certificate.revoke(login(account), certificate, RevocationReason.UNSPECIFIED);
            log.info("Revoked certificate {} with {}", certificate.getSerialNumber(), account.getDirectoryUri());
        } catch (AcmeException e) {
            throw new AcmeProtocolException("Failed to revoke certificate: " + e.getMessage(), e);
        }
    }

    private static Session session(String directoryUri) {
        try {
            return new Session(directoryUri);
        } catch (IllegalArgumentException e) {
            throw new AcmeProtocolException("Invalid ACME directory URI " + directoryUri, e);
        }
    }

    private static Login login(AcmeAccount account) {
        try {
            return session(account.getDirectoryUri()).login(new URL(account.getLocation()), account.getKeyPair());
        } catch (MalformedURLException e) {
            throw new AcmeProtocolException("Invalid ACME account location " + account.getLocation(), e);
        }
    }

    static OrderStatus toOrderStatus(Status status) {
        switch (status) {
            case PENDING:
                return OrderStatus.PENDING;
            case READY:
                return OrderStatus.READY;
            case PROCESSING:
                return OrderStatus.PROCESSING;
            case VALID:
                return OrderStatus.VALID;
            case INVALID:
            case REVOKED:
            case DEACTIVATED:
            case EXPIRED:
                return OrderStatus.INVALID;
            default:
                return OrderStatus.UNKNOWN;
        }
    }

    private static final class Acme4jOrder implements AcmeOrder {
        private final Order order;

        private Acme4jOrder(Order order) {
            this.order = order;
        }

        @Override
        public String getLocation() {
            return order.getLocation().toString();
        }

        @Override
        public List<AcmeAuthorization> getAuthorizations() {
            List<AcmeAuthorization> result = new ArrayList<>();
            for (Authorization authorization : order.getAuthorizations()) {
                result.add(new Acme4jAuthorization(authorization));
            }
            return result;
        }

        @Override
        public OrderStatus refresh() {
            try {
                order.update();
            } catch (AcmeRetryAfterException e) {
                log.debug("Order {} asks to retry after {}", order.getLocation(), e.getRetryAfter());
            } catch (AcmeException e) {
                throw new AcmeProtocolException("Failed to update order " + order.getLocation() + ": " + e.getMessage(), e);
            }
            return toOrderStatus(order.getStatus());
        }

        @Override
        public void finalizeOrder(byte[] csr) {
            try {
                order.execute(csr);
            } catch (AcmeException e) {
                throw new AcmeProtocolException("Failed to finalize order " + order.getLocation() + ": " + e.getMessage(), e);
            }
        }

        @Override
        public String downloadCertificateChain() {
            Certificate certificate = order.getCertificate();
            StringWriter writer = new StringWriter();
            try {
                certificate.writeCertificate(writer);
            } catch (IOException e) {
                throw new AcmeProtocolException("Failed to download certificate of order " + order.getLocation(), e);
            }
            return writer.toString();
        }
    }

    private static final class Acme4jAuthorization implements AcmeAuthorization {
        private final Authorization authorization;

        private Acme4jAuthorization(Authorization authorization) {
            this.authorization = authorization;
        }

        @Override
        public String getDomain() {
            return authorization.getIdentifier().getDomain();
        }

        @Override
        public boolean isWildcard() {
            return authorization.isWildcard();
        }

        @Override
        public boolean isValid() {
            return authorization.getStatus() == Status.VALID;
        }

        @Override
        public AcmeDnsChallenge findDnsChallenge() {
            Dns01Challenge challenge = authorization.findChallenge(Dns01Challenge.TYPE);
            return challenge == null ? null : new Acme4jDnsChallenge(challenge, getDomain());
        }
    }

    private static final class Acme4jDnsChallenge implements AcmeDnsChallenge {
        private final Dns01Challenge challenge;
        private final String domain;

        private Acme4jDnsChallenge(Dns01Challenge challenge, String domain) {
            this.challenge = challenge;
            this.domain = domain;
        }

        @Override
        public String getDigest() {
            return challenge.getDigest();
        }

        @Override
        public void trigger() {
            try {
                challenge.trigger();
            } catch (AcmeException e) {
                throw new AcmeProtocolException("Error answering challenge for " + domain + " : " + e.getMessage(), e);
            }
        }
    }
}
