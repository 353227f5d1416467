package com.certmanager.repository;

import com.certmanager.entity.CertificateAuthorityEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CertificateAuthorityRepository extends JpaRepository<CertificateAuthorityEntity, Long> {
    boolean existsByName(String name);

    List<CertificateAuthorityEntity> findBySignedBy(Long signedBy);
}
