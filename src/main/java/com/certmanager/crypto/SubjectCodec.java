package com.certmanager.crypto;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.pkcs.Attribute;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x500.AttributeTypeAndValue;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.util.IPAddress;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
public final class SubjectCodec {

    private static final Map<ASN1ObjectIdentifier, String> SHORT_NAMES = new HashMap<>();

    static {
        SHORT_NAMES.put(BCStyle.C, "C");
        SHORT_NAMES.put(BCStyle.ST, "ST");
        SHORT_NAMES.put(BCStyle.L, "L");
        SHORT_NAMES.put(BCStyle.O, "O");
        SHORT_NAMES.put(BCStyle.OU, "OU");
        SHORT_NAMES.put(BCStyle.CN, "CN");
        SHORT_NAMES.put(BCStyle.EmailAddress, "emailAddress");
    }

    private SubjectCodec() {
    }

    public static X500Name toX500Name(SubjectInfo subject) {
        X500NameBuilder builder = new X500NameBuilder(BCStyle.INSTANCE);
        addIfPresent(builder, BCStyle.C, subject.getCountry());
        addIfPresent(builder, BCStyle.ST, subject.getState());
        addIfPresent(builder, BCStyle.L, subject.getCity());
        addIfPresent(builder, BCStyle.O, subject.getOrganization());
        addIfPresent(builder, BCStyle.OU, subject.getOrganizationalUnit());
        addIfPresent(builder, BCStyle.CN, subject.getCommon());
        addIfPresent(builder, BCStyle.EmailAddress, subject.getEmail());
        return builder.build();
    }

    public static SubjectInfo fromX500Name(X500Name name, List<String> san) {
        return SubjectInfo.builder()
                .country(attribute(name, BCStyle.C))
                .state(attribute(name, BCStyle.ST))
                .city(attribute(name, BCStyle.L))
                .organization(attribute(name, BCStyle.O))
                .organizationalUnit(attribute(name, BCStyle.OU))
                .common(attribute(name, BCStyle.CN))
                .email(attribute(name, BCStyle.EmailAddress))
                .san(san)
                .build();
    }

    public static X500Name subjectOf(X509Certificate certificate) {
        return X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded());
    }

    public static CertificateInfo describe(X509Certificate certificate) {
        return CertificateInfo.builder()
                .subject(fromX500Name(subjectOf(certificate), subjectAltNames(certificate)))
                .serial(certificate.getSerialNumber())
                .digestAlgorithm(DigestAlgorithm.fromSignatureAlgorithm(certificate.getSigAlgName()))
                .build();
    }

    public static SubjectInfo describe(PKCS10CertificationRequest csr) {
        return fromX500Name(csr.getSubject(), subjectAltNames(csr));
    }

    /**
     * Builds DNS or IP general names; {@code DNS:} / {@code IP:} prefixes are accepted.
     */
    public static GeneralNames toGeneralNames(List<String> san) {
        List<GeneralName> names = new ArrayList<>();
        for (String entry : san) {
            String value = entry.trim();
            String upper = value.toUpperCase(Locale.ROOT);
            if (upper.startsWith("DNS:")) {
                value = value.substring(4).trim();
            } else if (upper.startsWith("IP:")) {
                value = value.substring(3).trim();
            }
            if (value.isEmpty()) {
                continue;
            }
            if (IPAddress.isValid(value)) {
                names.add(new GeneralName(GeneralName.iPAddress, value));
            } else {
                names.add(new GeneralName(GeneralName.dNSName, value));
            }
        }
        return new GeneralNames(names.toArray(new GeneralName[0]));
    }

    public static List<String> subjectAltNames(X509Certificate certificate) {
        List<String> result = new ArrayList<>();
        Collection<List<?>> names;
        try {
            names = certificate.getSubjectAlternativeNames();
        } catch (CertificateParsingException e) {
            log.debug("Unreadable subjectAltName extension", e);
            return result;
        }
        if (names == null) {
            return result;
        }
        for (List<?> name : names) {
            Integer tag = (Integer) name.get(0);
            if ((tag == GeneralName.dNSName || tag == GeneralName.iPAddress) && name.get(1) instanceof String) {
                result.add((String) name.get(1));
            }
        }
        return result;
    }

    public static List<String> subjectAltNames(PKCS10CertificationRequest csr) {
        List<String> result = new ArrayList<>();
        for (Attribute attribute : csr.getAttributes(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest)) {
            for (ASN1Encodable value : attribute.getAttrValues()) {
                GeneralNames names = GeneralNames.fromExtensions(
                        Extensions.getInstance(value), Extension.subjectAlternativeName);
                if (names != null) {
                    result.addAll(names(names));
                }
            }
        }
        return result;
    }

    /**
     * OpenSSL style one-line subject, e.g. {@code /C=US/O=Example/CN=host}.
     */
    public static String distinguishedName(X500Name name) {
        StringBuilder sb = new StringBuilder();
        for (RDN rdn : name.getRDNs()) {
            for (AttributeTypeAndValue atv : rdn.getTypesAndValues()) {
                sb.append('/').append(shortName(atv.getType())).append('=').append(valueOf(atv.getValue()));
            }
        }
        return sb.toString();
    }

    private static List<String> names(GeneralNames names) {
        List<String> result = new ArrayList<>();
        for (GeneralName name : names.getNames()) {
            if (name.getTagNo() == GeneralName.dNSName) {
                result.add(valueOf(name.getName()));
            } else if (name.getTagNo() == GeneralName.iPAddress) {
                byte[] octets = ASN1OctetString.getInstance(name.getName()).getOctets();
                try {
                    result.add(InetAddress.getByAddress(octets).getHostAddress());
                } catch (UnknownHostException e) {
                    log.debug("Skipping malformed IP subjectAltName", e);
                }
            }
        }
        return result;
    }

    private static String shortName(ASN1ObjectIdentifier oid) {
        String name = SHORT_NAMES.get(oid);
        if (name == null) {
            name = BCStyle.INSTANCE.oidToDisplayName(oid);
        }
        return name != null ? name : oid.getId();
    }

    private static String attribute(X500Name name, ASN1ObjectIdentifier oid) {
        RDN[] rdns = name.getRDNs(oid);
        if (rdns.length == 0) {
            return null;
        }
        return valueOf(rdns[0].getFirst().getValue());
    }

    private static String valueOf(ASN1Encodable value) {
        if (value instanceof ASN1String) {
            return ((ASN1String) value).getString();
        }
        return IETFUtils.valueToString(value);
    }

    private static void addIfPresent(X500NameBuilder builder, ASN1ObjectIdentifier oid, String value) {
        if (value != null && !value.isEmpty()) {
            builder.addRDN(oid, value);
        }
    }
}
