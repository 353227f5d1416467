package com.certmanager.service;

import com.certmanager.crypto.CertificateInfo;
import com.certmanager.crypto.SubjectInfo;
import com.certmanager.entity.CertificateRecord;
import com.certmanager.exception.ValidationErrors;

import java.util.ArrayList;
import java.util.List;

final class Records {

    private Records() {
    }

    static void applySubject(CertificateRecord record, SubjectInfo subject) {
        record.setCountry(subject.getCountry());
        record.setState(subject.getState());
        record.setCity(subject.getCity());
        record.setOrganization(subject.getOrganization());
        record.setOrganizationalUnit(subject.getOrganizationalUnit());
        record.setCommon(subject.getCommon());
        record.setEmail(subject.getEmail());
        record.setSan(joinSan(subject.getSan()));
    }

    static void applyCertificateInfo(CertificateRecord record, CertificateInfo info) {
        applySubject(record, info.getSubject());
        record.setSerial(info.getSerial());
        if (info.getDigestAlgorithm() != null) {
            record.setDigestAlgorithm(info.getDigestAlgorithm().name());
        }
    }

    /**
     * Single space separated form of a SAN list; commas and runs of whitespace collapse.
     */
    static String joinSan(List<String> san) {
        if (san == null) {
            return "";
        }
        List<String> tokens = new ArrayList<>();
        for (String entry : san) {
            if (entry == null) {
                continue;
            }
            for (String token : entry.trim().split("[\\s,]+")) {
                if (!token.isEmpty()) {
                    tokens.add(token);
                }
            }
        }
        return String.join(" ", tokens);
    }

    static void require(ValidationErrors errors, String schema, String field, Object value) {
        if (value == null || (value instanceof String && ((String) value).trim().isEmpty())) {
            errors.add(schema + "." + field, "This field is required");
        }
    }
}
