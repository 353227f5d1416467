package com.certmanager.repository;

import com.certmanager.entity.AcmeRegistrationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AcmeRegistrationRepository extends JpaRepository<AcmeRegistrationEntity, Long> {
    Optional<AcmeRegistrationEntity> findByDirectory(String directory);
}
