package com.certmanager.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Who issued a certificate: one of three terminal tags, or a CA managed by this system.
 */
public final class Issuer {

    public enum Kind {
        EXTERNAL("external"),
        SELF_SIGNED("self-signed"),
        SIGNATURE_PENDING("external - signature pending"),
        SIGNED_BY(null);

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }
    }

    /**
     * Names reserved for the terminal issuer tags.
     */
    public static final List<String> RESERVED_NAMES = Collections.unmodifiableList(Arrays.asList(
            Kind.EXTERNAL.tag, Kind.SELF_SIGNED.tag, Kind.SIGNATURE_PENDING.tag));

    private static final Issuer EXTERNAL = new Issuer(Kind.EXTERNAL, null);
    private static final Issuer SELF_SIGNED = new Issuer(Kind.SELF_SIGNED, null);
    private static final Issuer SIGNATURE_PENDING = new Issuer(Kind.SIGNATURE_PENDING, null);

    private final Kind kind;
    private final CertificateView authority;

    private Issuer(Kind kind, CertificateView authority) {
        this.kind = kind;
        this.authority = authority;
    }

    public static Issuer external() {
        return EXTERNAL;
    }

    public static Issuer selfSigned() {
        return SELF_SIGNED;
    }

    public static Issuer signaturePending() {
        return SIGNATURE_PENDING;
    }

    public static Issuer signedBy(CertificateView authority) {
        if (authority == null) {
            throw new IllegalArgumentException("authority is required");
        }
        return new Issuer(Kind.SIGNED_BY, authority);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The signing CA, {@code null} unless {@link Kind#SIGNED_BY}.
     */
    public CertificateView getAuthority() {
        return authority;
    }

    public boolean isTerminal() {
        return kind != Kind.SIGNED_BY;
    }

    @JsonValue
    public Object toJson() {
        return kind == Kind.SIGNED_BY ? authority : kind.tag;
    }

    @Override
    public String toString() {
        return kind == Kind.SIGNED_BY ? "signed by " + authority.getName() : kind.tag;
    }
}
