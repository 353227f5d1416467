package com.certmanager.service;

import com.certmanager.entity.CertificateAuthorityEntity;
import com.certmanager.entity.CertificateEntity;
import com.certmanager.exception.RecordNotFoundException;
import com.certmanager.repository.CertificateAuthorityRepository;
import com.certmanager.repository.CertificateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Hands out serial numbers that are unique within a whole CA hierarchy. The next serial is
 * always computed from the top-level root, so siblings never collide.
 */
@Slf4j
@Component
public class SerialNumberAllocator {

    @Autowired
    private CertificateAuthorityRepository authorityRepository;

    @Autowired
    private CertificateRepository certificateRepository;

    public BigInteger nextSerial(Long caId) {
        CertificateAuthorityEntity root = rootOf(caId);

        BigInteger max = null;
        Set<Long> visited = new HashSet<>();
        Deque<CertificateAuthorityEntity> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            CertificateAuthorityEntity ca = pending.pop();
            if (!visited.add(ca.getId())) {
                continue;
            }
            max = max(max, ca.getSerial());
            for (CertificateEntity certificate : certificateRepository.findBySignedBy(ca.getId())) {
                max = max(max, certificate.getSerial());
            }
            for (CertificateAuthorityEntity child : authorityRepository.findBySignedBy(ca.getId())) {
                max = max(max, child.getSerial());
                pending.push(child);
            }
        }

        BigInteger next = (max == null ? BigInteger.ZERO : max).add(BigInteger.ONE);
        log.debug("Next serial under root CA {} is {}", root.getName(), next);
        return next;
    }

    /**
     * Follows {@code signedby} up to the top-level CA.
     */
    CertificateAuthorityEntity rootOf(Long caId) {
        CertificateAuthorityEntity ca = authorityRepository.findById(caId)
                .orElseThrow(() -> new RecordNotFoundException("Certificate authority", caId));
        Set<Long> visited = new HashSet<>();
        visited.add(ca.getId());
        while (ca.getSignedBy() != null) {
            if (!visited.add(ca.getSignedBy())) {
                log.warn("CA hierarchy above {} contains a cycle", caId);
                break;
            }
            Optional<CertificateAuthorityEntity> parent = authorityRepository.findById(ca.getSignedBy());
            if (!parent.isPresent()) {
                break;
            }
            ca = parent.get();
        }
        return ca;
    }

    private static BigInteger max(BigInteger current, BigInteger candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.compareTo(current) > 0 ? candidate : current;
    }
}
