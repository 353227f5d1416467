package com.certmanager.crypto;

import com.certmanager.exception.CertificateManagementException;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.math.BigInteger;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

public final class CertificateBuilder {

    private final X500Name subject;
    private final PublicKey publicKey;
    private X500Name issuer;
    private PrivateKey signingKey;
    private BigInteger serial;
    private Instant notBefore = Instant.now();
    private Instant notAfter = notBefore.plus(Duration.ofDays(365));
    private final List<String> subjectAltNames = new ArrayList<>();
    private boolean certificateAuthority;
    private Integer pathLength;
    private boolean subjectKeyIdentifier;
    private DigestAlgorithm digest = DigestAlgorithm.SHA256;

    private CertificateBuilder(X500Name subject, PublicKey publicKey) {
        this.subject = subject;
        this.publicKey = publicKey;
    }

    public static CertificateBuilder forSubject(X500Name subject, PublicKey publicKey) {
        return new CertificateBuilder(subject, publicKey);
    }

    public CertificateBuilder issuedBy(X500Name issuer, PrivateKey signingKey) {
        this.issuer = issuer;
        this.signingKey = signingKey;
        return this;
    }

    public CertificateBuilder selfSigned(PrivateKey key) {
        return issuedBy(subject, key);
    }

    public CertificateBuilder serial(BigInteger serial) {
        this.serial = serial;
        return this;
    }

    public CertificateBuilder lifetimeDays(long days) {
        this.notAfter = notBefore.plus(Duration.ofDays(days));
        return this;
    }

    public CertificateBuilder subjectAltNames(List<String> san) {
        if (san != null) {
            subjectAltNames.addAll(san);
        }
        return this;
    }

    /**
     * Marks the certificate as a CA able to sign certificates and CRLs.
     *
     * @param pathLength maximum number of intermediates below, {@code null} for unbounded
     */
    public CertificateBuilder certificateAuthority(Integer pathLength) {
        this.certificateAuthority = true;
        this.pathLength = pathLength;
        return this;
    }

    public CertificateBuilder subjectKeyIdentifier() {
        this.subjectKeyIdentifier = true;
        return this;
    }

    public CertificateBuilder digest(DigestAlgorithm digest) {
        if (digest != null) {
            this.digest = digest;
        }
        return this;
    }

    public X509Certificate sign() {
        if (issuer == null || signingKey == null) {
            throw new IllegalStateException("Issuer and signing key are required");
        }
        if (serial == null) {
            throw new IllegalStateException("Serial number is required");
        }
        try {
            X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                    issuer, serial, Date.from(notBefore), Date.from(notAfter), subject, publicKey);

            if (!subjectAltNames.isEmpty()) {
                builder.addExtension(Extension.subjectAlternativeName, false,
                        SubjectCodec.toGeneralNames(subjectAltNames));
            }
            if (certificateAuthority) {
                builder.addExtension(Extension.basicConstraints, true,
                        pathLength == null ? new BasicConstraints(true) : new BasicConstraints(pathLength));
                builder.addExtension(Extension.keyUsage, true,
                        new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign));
            }
            if (subjectKeyIdentifier) {
                builder.addExtension(Extension.subjectKeyIdentifier, false,
                        new JcaX509ExtensionUtils().createSubjectKeyIdentifier(publicKey));
            }

            ContentSigner signer = new JcaContentSignerBuilder(digest.signatureAlgorithm(signingKey))
                    .build(signingKey);
            return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
        } catch (CertIOException | NoSuchAlgorithmException | OperatorCreationException | CertificateException e) {
            throw new CertificateManagementException("Unable to sign certificate for " + subject, e);
        }
    }
}
