package com.certmanager.service;

import com.certmanager.entity.CertificateAuthorityEntity;
import com.certmanager.entity.CertificateEntity;
import com.certmanager.entity.CertificateType;
import com.certmanager.exception.RecordNotFoundException;
import com.certmanager.repository.CertificateAuthorityRepository;
import com.certmanager.repository.CertificateRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import(SerialNumberAllocator.class)
class SerialNumberAllocatorTest {

    @Autowired
    private SerialNumberAllocator allocator;

    @Autowired
    private CertificateAuthorityRepository authorityRepository;

    @Autowired
    private CertificateRepository certificateRepository;

    @Test
    void testNextSerialFollowsHighestInHierarchy() {
        CertificateAuthorityEntity root = authorityRepository.save(ca("root", 1, null));
        certificateRepository.save(CertificateEntity.builder()
                .name("leaf")
                .type(CertificateType.CERT_INTERNAL)
                .serial(BigInteger.valueOf(2))
                .signedBy(root.getId())
                .build());

        assertEquals(BigInteger.valueOf(3), allocator.nextSerial(root.getId()));
    }

    @Test
    void testSiblingsUnderIntermediatesShareOneSequence() {
        CertificateAuthorityEntity root = authorityRepository.save(ca("root", 5, null));
        CertificateAuthorityEntity left = authorityRepository.save(ca("left", 6, root.getId()));
        CertificateAuthorityEntity right = authorityRepository.save(ca("right", 7, root.getId()));
        certificateRepository.save(CertificateEntity.builder()
                .name("deep")
                .type(CertificateType.CERT_INTERNAL)
                .serial(BigInteger.valueOf(41))
                .signedBy(left.getId())
                .build());

        assertEquals(BigInteger.valueOf(42), allocator.nextSerial(right.getId()));
        assertEquals(BigInteger.valueOf(42), allocator.nextSerial(root.getId()));
    }

    @Test
    void testSerialsAreStrictlyIncreasingAsTheyAreUsed() {
        CertificateAuthorityEntity root = authorityRepository.save(ca("root", 1, null));
        BigInteger previous = BigInteger.ONE;
        for (int i = 0; i < 5; i++) {
            BigInteger next = allocator.nextSerial(root.getId());
            assertTrue(next.compareTo(previous) > 0);
            certificateRepository.save(CertificateEntity.builder()
                    .name("cert" + i)
                    .type(CertificateType.CERT_INTERNAL)
                    .serial(next)
                    .signedBy(root.getId())
                    .build());
            previous = next;
        }
    }

    @Test
    void testMissingSerialsAreIgnored() {
        CertificateAuthorityEntity root = authorityRepository.save(ca("legacy", 0, null));
        root.setSerial(null);
        authorityRepository.save(root);

        assertEquals(BigInteger.ONE, allocator.nextSerial(root.getId()));
    }

    @Test
    void testUnknownCaIsRejected() {
        assertThrows(RecordNotFoundException.class, () -> allocator.nextSerial(9999L));
    }

    private static CertificateAuthorityEntity ca(String name, long serial, Long signedBy) {
        return CertificateAuthorityEntity.builder()
                .name(name)
                .type(signedBy == null ? CertificateType.CA_INTERNAL : CertificateType.CA_INTERMEDIATE)
                .serial(BigInteger.valueOf(serial))
                .signedBy(signedBy)
                .build();
    }
}
