package com.qoeboost.api.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * User - JPA Entity representing a registered QoE Boost account.
 *
 * Maps to the 'users' table (see db/qoe-schema.sql). The same class is used
 * as the record type of the in-memory fallback store, so it carries no
 * Hibernate-managed lifecycle callbacks: timestamps are assigned by the
 * service layer from the application Clock.
 *
 * Constraints:
 * - username: UNIQUE, case-sensitive, immutable after creation
 * - email: UNIQUE
 * - passwordHash: BCrypt hash, never serialized to clients
 *
 * Lifecycle:
 * - Created on registration (AuthService.register)
 * - Only the active flag may change afterwards
 * - Never hard-deleted
 */
@Entity
@Table(name = "users")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "username", unique = true, nullable = false, updatable = false)
    private String username;

    @Column(name = "email", unique = true, nullable = false)
    private String email;

    /**
     * BCrypt hash including its salt. Excluded from toString so it never
     * reaches a log line.
     */
    @ToString.Exclude
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    /**
     * Network provider the user is subscribed to, as reported at registration.
     */
    @Column(name = "provider")
    private String provider;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
