package com.certmanager;

import com.certmanager.crypto.CertificateBuilder;
import com.certmanager.crypto.CsrFactory;
import com.certmanager.crypto.DigestAlgorithm;
import com.certmanager.crypto.KeyPairs;
import com.certmanager.crypto.PemCodec;
import com.certmanager.crypto.SubjectCodec;
import com.certmanager.crypto.SubjectInfo;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.List;

/**
 * Key material for tests. Keys are generated once per JVM.
 */
public final class TestCertificates {

    public static final KeyPair ROOT_KEY = KeyPairs.generateRsa(2048);
    public static final KeyPair LEAF_KEY = KeyPairs.generateRsa(2048);

    private TestCertificates() {
    }

    public static SubjectInfo subject(String common, String... san) {
        SubjectInfo subject = SubjectInfo.builder()
                .country("US")
                .state("Tennessee")
                .city("Maryville")
                .organization("Test Org")
                .common(common)
                .email("admin@example.com")
                .build();
        for (String entry : san) {
            subject.getSan().add(entry);
        }
        return subject;
    }

    public static X509Certificate selfSignedCa(String common, long serial) {
        return CertificateBuilder
                .forSubject(SubjectCodec.toX500Name(subject(common)), ROOT_KEY.getPublic())
                .selfSigned(ROOT_KEY.getPrivate())
                .serial(BigInteger.valueOf(serial))
                .lifetimeDays(3650)
                .certificateAuthority(null)
                .subjectKeyIdentifier()
                .sign();
    }

    public static X509Certificate leaf(String common, X509Certificate ca, long serial, long lifetimeDays) {
        return CertificateBuilder
                .forSubject(SubjectCodec.toX500Name(subject(common)), LEAF_KEY.getPublic())
                .issuedBy(SubjectCodec.subjectOf(ca), ROOT_KEY.getPrivate())
                .serial(BigInteger.valueOf(serial))
                .lifetimeDays(lifetimeDays)
                .subjectAltNames(Collections.singletonList(common))
                .sign();
    }

    public static String csrPem(String common, List<String> san) {
        SubjectInfo subject = subject(common);
        subject.setSan(san);
        return PemCodec.writeCsr(CsrFactory.create(subject, LEAF_KEY, DigestAlgorithm.SHA256));
    }

    public static String pem(X509Certificate certificate) {
        return PemCodec.writeCertificate(certificate);
    }
}
