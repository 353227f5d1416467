package com.certmanager.model;

import com.certmanager.entity.CertificateType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Certificate creation request, one subclass per {@code create_type}. The hierarchy is closed:
 * the abstract types have package private constructors and the concrete variants are final, so
 * {@link Visitor} covers every request.
 */
@Data
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "create_type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CertificateCreateRequest.Internal.class, name = "CERTIFICATE_CREATE_INTERNAL"),
        @JsonSubTypes.Type(value = CertificateCreateRequest.Imported.class, name = "CERTIFICATE_CREATE_IMPORTED"),
        @JsonSubTypes.Type(value = CertificateCreateRequest.Csr.class, name = "CERTIFICATE_CREATE_CSR"),
        @JsonSubTypes.Type(value = CertificateCreateRequest.ImportedCsr.class, name = "CERTIFICATE_CREATE_IMPORTED_CSR"),
        @JsonSubTypes.Type(value = CertificateCreateRequest.Acme.class, name = "CERTIFICATE_CREATE_ACME")
})
public abstract class CertificateCreateRequest {

    private String name;

    CertificateCreateRequest() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    @JsonIgnore
    public abstract CommonAttributes getCommonAttributes();

    public interface Visitor<R> {
        R visitInternal(Internal request);

        R visitImported(Imported request);

        R visitCsr(Csr request);

        R visitImportedCsr(ImportedCsr request);

        R visitAcme(Acme request);

        R visitSigned(Signed request);
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public abstract static class WithSubject extends CertificateCreateRequest implements SubjectRequest {
        private Integer keyLength;
        private String digestAlgorithm;
        private String country;
        private String state;
        private String city;
        private String organization;
        private String organizationalUnit;
        private String common;
        private String email;
        private List<String> san;

        WithSubject() {
        }
    }

    /**
     * New key pair and certificate signed by a CA of this system.
     */
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class Internal extends WithSubject {
        private Integer lifetime;
        @JsonProperty("signedby")
        private Long signedBy;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInternal(this);
        }

        @Override
        public CommonAttributes getCommonAttributes() {
            return CommonAttributes.builder()
                    .country(getCountry())
                    .keyLength(getKeyLength())
                    .signedBy(signedBy)
                    .build();
        }
    }

    /**
     * New key pair and certification request awaiting a signature.
     */
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class Csr extends WithSubject {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCsr(this);
        }

        @Override
        public CommonAttributes getCommonAttributes() {
            return CommonAttributes.builder()
                    .country(getCountry())
                    .keyLength(getKeyLength())
                    .build();
        }
    }

    /**
     * Existing certificate (or chain) with its key, or with the key of a stored CSR.
     */
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true, exclude = {"privateKey", "passphrase"})
    public static final class Imported extends CertificateCreateRequest {
        private String certificate;
        @JsonProperty("privatekey")
        private String privateKey;
        private String passphrase;
        private Long csrId;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImported(this);
        }

        @Override
        public CommonAttributes getCommonAttributes() {
            return CommonAttributes.builder()
                    .certificate(certificate)
                    .privateKey(privateKey)
                    .passphrase(passphrase)
                    .csrId(csrId)
                    .build();
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true, exclude = {"privateKey", "passphrase"})
    public static final class ImportedCsr extends CertificateCreateRequest {
        @JsonProperty("CSR")
        private String csr;
        @JsonProperty("privatekey")
        private String privateKey;
        private String passphrase;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImportedCsr(this);
        }

        @Override
        public CommonAttributes getCommonAttributes() {
            return CommonAttributes.builder()
                    .csr(csr)
                    .privateKey(privateKey)
                    .passphrase(passphrase)
                    .build();
        }
    }

    /**
     * Certificate issued by an ACME directory for a stored CSR.
     */
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static final class Acme extends CertificateCreateRequest {
        public static final int DEFAULT_RENEW_DAYS = 10;

        private Long csrId;
        private String acmeDirectoryUri;
        private Map<String, Long> dnsMapping;
        private boolean tos;
        private Integer renewDays = DEFAULT_RENEW_DAYS;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAcme(this);
        }

        @Override
        public CommonAttributes getCommonAttributes() {
            return CommonAttributes.builder()
                    .csrId(csrId)
                    .build();
        }
    }

    /**
     * Already signed certificate handed over by the CSR signing flow. Not accepted from clients.
     */
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true, exclude = "privateKey")
    public static final class Signed extends CertificateCreateRequest {
        private String certificate;
        private String privateKey;
        private CertificateType type;
        private Long signedBy;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSigned(this);
        }

        @Override
        public CommonAttributes getCommonAttributes() {
            return CommonAttributes.builder()
                    .certificate(certificate)
                    .privateKey(privateKey)
                    .signedBy(signedBy)
                    .build();
        }
    }
}
