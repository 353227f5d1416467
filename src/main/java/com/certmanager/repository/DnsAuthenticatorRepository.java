package com.certmanager.repository;

import com.certmanager.entity.DnsAuthenticatorEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DnsAuthenticatorRepository extends JpaRepository<DnsAuthenticatorEntity, Long> {
}
