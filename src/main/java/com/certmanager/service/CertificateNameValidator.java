package com.certmanager.service;

import com.certmanager.exception.ValidationErrors;
import com.certmanager.model.Issuer;
import com.certmanager.repository.CertificateAuthorityRepository;
import com.certmanager.repository.CertificateRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Names are shared by certificates and certificate authorities: unique across both stores and
 * never one of the issuer tags.
 */
@Component
public class CertificateNameValidator {

    private static final Pattern NAME = Pattern.compile("^[A-Za-z0-9_-]+$");

    @Autowired
    private CertificateRepository certificateRepository;

    @Autowired
    private CertificateAuthorityRepository authorityRepository;

    public ValidationErrors validate(String name, String field, ValidationErrors errors) {
        if (name != null && (certificateRepository.existsByName(name) || authorityRepository.existsByName(name))) {
            errors.add(field, "A certificate with this name already exists");
        }
        if (name != null && Issuer.RESERVED_NAMES.contains(name)) {
            errors.add(field, name + " is a reserved internal keyword for Certificate Management");
        }
        if (name == null || !NAME.matcher(name).matches()) {
            errors.add(field, "Use alphanumeric characters, \"_\" and \"-\".");
        }
        return errors;
    }
}
