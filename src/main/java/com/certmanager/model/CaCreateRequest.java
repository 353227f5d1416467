package com.certmanager.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

@Data
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "create_type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CaCreateRequest.Internal.class, name = "CA_CREATE_INTERNAL"),
        @JsonSubTypes.Type(value = CaCreateRequest.Imported.class, name = "CA_CREATE_IMPORTED"),
        @JsonSubTypes.Type(value = CaCreateRequest.Intermediate.class, name = "CA_CREATE_INTERMEDIATE")
})
public abstract class CaCreateRequest {

    private String name;

    CaCreateRequest() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    @JsonIgnore
    public abstract CommonAttributes getCommonAttributes();

    public interface Visitor<R> {
        R visitInternal(Internal request);

        R visitImported(Imported request);

        R visitIntermediate(Intermediate request);
    }

    /**
     * Self-signed root.
     */
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class Internal extends CaCreateRequest implements SubjectRequest {
        private Integer keyLength;
        private String digestAlgorithm;
        private Integer lifetime;
        private String country;
        private String state;
        private String city;
        private String organization;
        private String organizationalUnit;
        private String common;
        private String email;
        private List<String> san;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInternal(this);
        }

        @Override
        public CommonAttributes getCommonAttributes() {
            return CommonAttributes.builder()
                    .country(country)
                    .keyLength(keyLength)
                    .build();
        }
    }

    /**
     * Intermediate signed by a CA of this system.
     */
    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class Intermediate extends Internal {
        @JsonProperty("signedby")
        private Long signedBy;

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIntermediate(this);
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

    @Data
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true, exclude = {"privateKey", "passphrase"})
    public static class Imported extends CaCreateRequest {
        private String certificate;
        @JsonProperty("privatekey")
        private String privateKey;
        private String passphrase;

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
                    .build();
        }
    }
}
