package com.certmanager.crypto;

import java.security.Key;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public enum DigestAlgorithm {
    SHA1,
    SHA224,
    SHA256,
    SHA384,
    SHA512;

    private static final Pattern SIGNATURE_DIGEST = Pattern.compile("^(.+?)with", Pattern.CASE_INSENSITIVE);

    /**
     * JCA signature algorithm name for signing with the given key, e.g. {@code SHA256withRSA}.
     */
    public String signatureAlgorithm(Key signingKey) {
        String keyAlgorithm = signingKey.getAlgorithm();
        if ("EC".equalsIgnoreCase(keyAlgorithm) || "ECDSA".equalsIgnoreCase(keyAlgorithm)) {
            return name() + "withECDSA";
        }
        if ("DSA".equalsIgnoreCase(keyAlgorithm)) {
            return name() + "withDSA";
        }
        return name() + "withRSA";
    }

    /**
     * Digest part of a signature algorithm name such as {@code SHA256WITHRSA}, or {@code null}.
     */
    public static DigestAlgorithm fromSignatureAlgorithm(String signatureAlgorithm) {
        if (signatureAlgorithm == null) {
            return null;
        }
        Matcher m = SIGNATURE_DIGEST.matcher(signatureAlgorithm);
        if (!m.find()) {
            return null;
        }
        String digest = m.group(1).toUpperCase(Locale.ROOT).replace("-", "");
        for (DigestAlgorithm value : values()) {
            if (value.name().equals(digest)) {
                return value;
            }
        }
        return null;
    }

    public static DigestAlgorithm parse(String value, DigestAlgorithm fallback) {
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
