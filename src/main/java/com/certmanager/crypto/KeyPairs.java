package com.certmanager.crypto;

import com.certmanager.exception.CertificateManagementException;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.cert.X509Certificate;

public final class KeyPairs {
    private static final String ALGORITHM = "RSA";

    private static final SecureRandom RANDOM = new SecureRandom();

    private KeyPairs() {
    }

    public static KeyPair generateRsa(int keySize) {
        try {
            KeyPairGenerator gen = KeyPairGenerator.getInstance(ALGORITHM);
            gen.initialize(keySize, RANDOM);
            return gen.generateKeyPair();
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new CertificateManagementException("Unable to generate " + keySize + " bit RSA key", e);
        }
    }

    /**
     * Whether the private key belongs to the certificate's public key, proven by a signature
     * round trip over random data. Key algorithm names are not compared, providers disagree on
     * them ({@code EC} against {@code ECDSA}); a key of another family fails {@code initVerify}.
     */
    public static boolean matches(X509Certificate certificate, PrivateKey privateKey) {
        PublicKey publicKey = certificate.getPublicKey();
        String algorithm = DigestAlgorithm.SHA256.signatureAlgorithm(privateKey);
        byte[] challenge = new byte[32];
        RANDOM.nextBytes(challenge);
        try {
            Signature signer = Signature.getInstance(algorithm);
            signer.initSign(privateKey);
            signer.update(challenge);
            byte[] signature = signer.sign();

            Signature verifier = Signature.getInstance(algorithm);
            verifier.initVerify(publicKey);
            verifier.update(challenge);
            return verifier.verify(signature);
        } catch (GeneralSecurityException e) {
            return false;
        }
    }
}
