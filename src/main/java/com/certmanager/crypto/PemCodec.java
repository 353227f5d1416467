package com.certmanager.crypto;

import com.certmanager.exception.PassphraseException;
import com.certmanager.exception.PemFormatException;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8EncryptorBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.OutputEncryptor;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.util.io.pem.PemObjectGenerator;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PemCodec {

    private static final Provider PROVIDER = new BouncyCastleProvider();

    private static final Pattern CERTIFICATE_BLOCK = Pattern.compile(
            "-{5}BEGIN CERTIFICATE-{5}[^-]+-{5}END CERTIFICATE-{5}");

    private PemCodec() {
    }

    /**
     * Certificate PEM blocks in document order.
     */
    public static List<String> splitCertificates(String pem) {
        List<String> blocks = new ArrayList<>();
        if (pem == null) {
            return blocks;
        }
        Matcher m = CERTIFICATE_BLOCK.matcher(pem);
        while (m.find()) {
            blocks.add(m.group());
        }
        return blocks;
    }

    public static boolean isChain(String pem) {
        return splitCertificates(pem).size() > 1;
    }

    /**
     * Parses the first certificate of a PEM document.
     */
    public static X509Certificate parseCertificate(String pem) {
        Object parsed = readFirst(pem, "certificate");
        if (!(parsed instanceof X509CertificateHolder)) {
            throw new PemFormatException("Certificate not in PEM format");
        }
        try {
            return new JcaX509CertificateConverter().getCertificate((X509CertificateHolder) parsed);
        } catch (CertificateException e) {
            throw new PemFormatException("Certificate not in PEM format", e);
        }
    }

    public static PKCS10CertificationRequest parseCsr(String pem) {
        Object parsed = readFirst(pem, "CSR");
        if (!(parsed instanceof PKCS10CertificationRequest)) {
            throw new PemFormatException("Not a PKCS#10 certification request");
        }
        return (PKCS10CertificationRequest) parsed;
    }

    /**
     * Loads a private key, decrypting it when the PEM is passphrase protected.
     *
     * @throws PemFormatException  when the text holds no private key
     * @throws PassphraseException when the key is encrypted and the passphrase is missing or wrong
     */
    public static PrivateKey parsePrivateKey(String pem, String passphrase) {
        Object parsed = readFirst(pem, "private key");
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(PROVIDER);
        try {
            if (parsed instanceof PEMKeyPair) {
                return converter.getKeyPair((PEMKeyPair) parsed).getPrivate();
            }
            if (parsed instanceof PrivateKeyInfo) {
                return converter.getPrivateKey((PrivateKeyInfo) parsed);
            }
        } catch (IOException e) {
            throw new PemFormatException("Unsupported private key", e);
        }
        if (parsed instanceof PKCS8EncryptedPrivateKeyInfo || parsed instanceof PEMEncryptedKeyPair) {
            if (passphrase == null || passphrase.isEmpty()) {
                throw new PassphraseException("Private key is encrypted and no passphrase was given");
            }
            return decrypt(parsed, passphrase.toCharArray(), converter);
        }
        throw new PemFormatException("Not a private key");
    }

    public static PrivateKey parsePrivateKey(String pem) {
        return parsePrivateKey(pem, null);
    }

    private static PrivateKey decrypt(Object encrypted, char[] passphrase, JcaPEMKeyConverter converter) {
        try {
            if (encrypted instanceof PKCS8EncryptedPrivateKeyInfo) {
                PrivateKeyInfo info = ((PKCS8EncryptedPrivateKeyInfo) encrypted).decryptPrivateKeyInfo(
                        new JceOpenSSLPKCS8DecryptorProviderBuilder().setProvider(PROVIDER).build(passphrase));
                return converter.getPrivateKey(info);
            }
            PEMKeyPair pair = ((PEMEncryptedKeyPair) encrypted).decryptKeyPair(
                    new JcePEMDecryptorProviderBuilder().setProvider(PROVIDER).build(passphrase));
            return converter.getKeyPair(pair).getPrivate();
        } catch (Exception e) {
            // any failure past this point stems from the key material the passphrase produced
            throw new PassphraseException("Unable to decrypt private key with the given passphrase", e);
        }
    }

    public static String writeCertificate(X509Certificate certificate) {
        return writeObject(certificate);
    }

    public static String writeCsr(PKCS10CertificationRequest csr) {
        return writeObject(csr);
    }

    /**
     * Unencrypted PKCS#8 ({@code BEGIN PRIVATE KEY}).
     */
    public static String writePrivateKey(PrivateKey key) {
        return writePrivateKey(key, null);
    }

    public static String writePrivateKey(PrivateKey key, String passphrase) {
        try {
            OutputEncryptor encryptor = null;
            if (passphrase != null && !passphrase.isEmpty()) {
                encryptor = new JceOpenSSLPKCS8EncryptorBuilder(JcaPKCS8Generator.AES_256_CBC)
                        .setProvider(PROVIDER)
                        .setPassword(passphrase.toCharArray())
                        .build();
            }
            return writeObject(new JcaPKCS8Generator(key, encryptor));
        } catch (OperatorCreationException | IOException e) {
            throw new PemFormatException("Unable to encode private key", e);
        }
    }

    /**
     * Re-encodes a certificate PEM, normalizing whitespace and line endings.
     */
    public static String normalizeCertificate(String pem) {
        return writeCertificate(parseCertificate(pem));
    }

    public static String normalizeCsr(String pem) {
        return writeCsr(parseCsr(pem));
    }

    public static String normalizePrivateKey(String pem) {
        return writePrivateKey(parsePrivateKey(pem));
    }

    private static Object readFirst(String pem, String what) {
        if (pem == null || pem.trim().isEmpty()) {
            throw new PemFormatException("No " + what + " given");
        }
        Object parsed;
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            parsed = parser.readObject();
        } catch (IOException | RuntimeException e) {
            throw new PemFormatException("Malformed PEM " + what, e);
        }
        if (parsed == null) {
            throw new PemFormatException("No PEM encoded " + what + " found");
        }
        return parsed;
    }

    private static String writeObject(Object object) {
        StringWriter sw = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(sw)) {
            if (object instanceof PemObjectGenerator) {
                writer.writeObject((PemObjectGenerator) object);
            } else {
                writer.writeObject(object);
            }
            writer.flush();
        } catch (IOException e) {
            throw new PemFormatException("Unable to write PEM", e);
        }
        return sw.toString();
    }
}
