package com.certmanager.crypto;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class CertificateInfo {
    SubjectInfo subject;
    BigInteger serial;
    DigestAlgorithm digestAlgorithm;
}
