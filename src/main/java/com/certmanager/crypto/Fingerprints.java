package com.certmanager.crypto;

import com.certmanager.exception.CertificateManagementException;
import org.bouncycastle.util.encoders.Hex;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.Locale;

public final class Fingerprints {

    private Fingerprints() {
    }

    /**
     * SHA-1 digest of the DER encoding as colon separated upper case hex.
     */
    public static String sha1(X509Certificate certificate) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-1").digest(certificate.getEncoded());
            String hex = Hex.toHexString(digest).toUpperCase(Locale.ROOT);
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < hex.length(); i += 2) {
                if (i > 0) {
                    sb.append(':');
                }
                sb.append(hex, i, i + 2);
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException | CertificateEncodingException e) {
            throw new CertificateManagementException("Unable to fingerprint certificate", e);
        }
    }
}
