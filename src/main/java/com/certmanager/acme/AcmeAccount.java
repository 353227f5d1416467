package com.certmanager.acme;

import lombok.ToString;
import lombok.Value;

import java.security.KeyPair;

@Value
@ToString(exclude = "keyPair")
public class AcmeAccount {
    String directoryUri;
    String location;
    KeyPair keyPair;
}
