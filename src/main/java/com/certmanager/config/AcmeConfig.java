package com.certmanager.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import javax.annotation.PostConstruct;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Getter
@Configuration
@EnableScheduling
public class AcmeConfig {

    public static final String LETS_ENCRYPT_STAGING = "https://acme-staging-v02.api.letsencrypt.org/directory";
    public static final String LETS_ENCRYPT_PRODUCTION = "https://acme-v02.api.letsencrypt.org/directory";

    @Value("${pki.acme.finalize-timeout:10m}")
    private Duration finalizeTimeout;

    @Value("${pki.acme.poll-interval:3s}")
    private Duration pollInterval;

    @Value("${pki.acme.account-key-size:2048}")
    private int accountKeySize;

    @PostConstruct
    public void init() {
        if (finalizeTimeout.isNegative() || finalizeTimeout.isZero()) {
            throw new IllegalStateException("pki.acme.finalize-timeout must be positive");
        }
        if (pollInterval.isNegative()) {
            throw new IllegalStateException("pki.acme.poll-interval must not be negative");
        }
        log.info("ACME finalize timeout {}, poll interval {}", finalizeTimeout, pollInterval);
    }

    /**
     * Well known directories offered to users, URI to display name.
     */
    public Map<String, String> getServerChoices() {
        Map<String, String> choices = new LinkedHashMap<>();
        choices.put(LETS_ENCRYPT_STAGING, "Let's Encrypt Staging Directory");
        choices.put(LETS_ENCRYPT_PRODUCTION, "Let's Encrypt Production Directory");
        return Collections.unmodifiableMap(choices);
    }
}
