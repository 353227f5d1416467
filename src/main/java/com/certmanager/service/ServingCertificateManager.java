package com.certmanager.service;

import com.certmanager.entity.CertificateRecord;
import com.certmanager.entity.CertificateType;
import com.certmanager.exception.CertificateManagementException;
import com.certmanager.repository.CertificateAuthorityRepository;
import com.certmanager.repository.CertificateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps the certificate directory in sync with the store: every certificate, key and CSR is
 * written to {@code <name>.crt|.key|.csr}, files of deleted records are removed.
 */
@Slf4j
@Service
public class ServingCertificateManager implements ServiceReloadHook {

    private static final String[] EXTENSIONS = {".crt", ".key", ".csr"};

    @Autowired
    private CertificateRepository certificateRepository;

    @Autowired
    private CertificateAuthorityRepository authorityRepository;

    @Autowired
    private CertificateExtender extender;

    @Override
    public synchronized void reload() {
        List<CertificateRecord> records = new ArrayList<>();
        records.addAll(certificateRepository.findAll());
        records.addAll(authorityRepository.findAll());
        try {
            sync(Paths.get(extender.rootPathOf(CertificateType.CERT_EXISTING)), records, false);
            sync(Paths.get(extender.rootPathOf(CertificateType.CA_EXISTING)), records, true);
        } catch (IOException e) {
            log.error("Failed to write certificates", e);
            throw new CertificateManagementException("Failed to write certificates: " + e.getMessage(), e);
        }
        log.info("Certificate files updated for {} records", records.size());
    }

    private void sync(Path directory, List<CertificateRecord> records, boolean authorities) throws IOException {
        Files.createDirectories(directory);
        Set<String> expected = new HashSet<>();
        for (CertificateRecord record : records) {
            if (record.getType().isAuthority() != authorities) {
                continue;
            }
            write(directory, record.getName() + ".crt", record.getCertificate(), expected);
            write(directory, record.getName() + ".key", record.getPrivateKey(), expected);
            write(directory, record.getName() + ".csr", record.getCsr(), expected);
        }

        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (Files.isRegularFile(file) && hasManagedExtension(name) && !expected.contains(name)) {
                    Files.delete(file);
                    log.debug("Removed stale {}", file);
                }
            }
        }
    }

    private void write(Path directory, String fileName, String pem, Set<String> expected) throws IOException {
        if (pem == null || pem.trim().isEmpty()) {
            return;
        }
        Path file = directory.resolve(fileName);
        Files.write(file, pem.getBytes(StandardCharsets.UTF_8));
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.debug("File system of {} has no POSIX permissions", file);
        }
        expected.add(fileName);
    }

    private static boolean hasManagedExtension(String name) {
        for (String extension : EXTENSIONS) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
