package com.brainvault.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Minimal account record keyed by the identity provider's subject id.
 *
 * Database Table: users
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_users_external_auth_id", columnList = "external_auth_id", unique = true),
    @Index(name = "idx_users_email", columnList = "email", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class User {

    public static final String DEFAULT_SUBSCRIPTION = "free";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Subject claim of the bearer token. Ideas reference users through this value.
     */
    @Column(name = "external_auth_id", nullable = false, unique = true, updatable = false, length = 100)
    private String externalAuthId;

    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    /**
     * Free-text tier name.
     */
    @Column(name = "subscription", nullable = false, length = 50)
    private String subscription = DEFAULT_SUBSCRIPTION;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public User(String externalAuthId, String email, String subscription) {
        this.externalAuthId = externalAuthId;
        this.email = email;
        this.subscription = subscription != null ? subscription : DEFAULT_SUBSCRIPTION;
    }
}
