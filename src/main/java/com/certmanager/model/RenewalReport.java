package com.certmanager.model;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one renewal sweep. Every certificate due for renewal ends up either in
 * {@link #getRenewed()} or in {@link #getFailures()}.
 */
@Getter
@ToString
public class RenewalReport {
    private final List<String> renewed = new ArrayList<>();
    private final Map<String, String> failures = new LinkedHashMap<>();
    private boolean skipped;

    public static RenewalReport skippedSweep() {
        RenewalReport report = new RenewalReport();
        report.skipped = true;
        return report;
    }

    public void renewed(String name) {
        renewed.add(name);
    }

    public void failed(String name, String reason) {
        failures.put(name, reason);
    }

    public int getAttempted() {
        return renewed.size() + failures.size();
    }
}
