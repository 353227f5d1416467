package com.certmanager.crypto;

import com.certmanager.exception.CertificateManagementException;
import com.certmanager.exception.PemFormatException;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.ExtensionsGenerator;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCS10CertificationRequestBuilder;
import org.bouncycastle.pkcs.jcajce.JcaPKCS10CertificationRequest;
import org.bouncycastle.pkcs.jcajce.JcaPKCS10CertificationRequestBuilder;

import java.io.IOException;
import java.security.InvalidKeyException;
import java.security.KeyPair;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;

public final class CsrFactory {

    private CsrFactory() {
    }

    public static PKCS10CertificationRequest create(SubjectInfo subject, KeyPair pair, DigestAlgorithm digest) {
        try {
            PKCS10CertificationRequestBuilder builder = new JcaPKCS10CertificationRequestBuilder(
                    SubjectCodec.toX500Name(subject), pair.getPublic());
            if (subject.getSan() != null && !subject.getSan().isEmpty()) {
                ExtensionsGenerator extensions = new ExtensionsGenerator();
                extensions.addExtension(Extension.subjectAlternativeName, false,
                        SubjectCodec.toGeneralNames(subject.getSan()));
                builder.addAttribute(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest, extensions.generate());
            }
            ContentSigner signer = new JcaContentSignerBuilder(digest.signatureAlgorithm(pair.getPrivate()))
                    .build(pair.getPrivate());
            return builder.build(signer);
        } catch (IOException | OperatorCreationException e) {
            throw new CertificateManagementException("Unable to create certification request", e);
        }
    }

    public static PublicKey publicKeyOf(PKCS10CertificationRequest csr) {
        try {
            return new JcaPKCS10CertificationRequest(csr).getPublicKey();
        } catch (InvalidKeyException | NoSuchAlgorithmException e) {
            throw new PemFormatException("CSR carries an unusable public key", e);
        }
    }
}
