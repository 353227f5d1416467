package com.certmanager.repository;

import com.certmanager.entity.CertificateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CertificateRepository extends JpaRepository<CertificateEntity, Long> {
    Optional<CertificateEntity> findByName(String name);

    boolean existsByName(String name);

    List<CertificateEntity> findBySignedBy(Long signedBy);

    List<CertificateEntity> findByAcmeRegistrationIdIsNotNull();
}
