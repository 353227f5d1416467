package com.certmanager.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import javax.persistence.Column;
import javax.persistence.Entity;
import javax.persistence.GeneratedValue;
import javax.persistence.GenerationType;
import javax.persistence.Id;
import javax.persistence.Table;
import java.time.LocalDateTime;

@Data
@Entity
@Table(name = "acme_registrations")
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "accountKeyPair")
public class AcmeRegistrationEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(unique = true, nullable = false, length = 512)
    private String directory;

    @Column(nullable = false, length = 512)
    private String uri;

    @Column(length = 512)
    private String tos;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String accountKeyPair;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
