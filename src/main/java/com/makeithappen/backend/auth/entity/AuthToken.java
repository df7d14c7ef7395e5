package com.makeithappen.backend.auth.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/** Opaque access token; issued by the identity service, only read here. */
@Getter
@Setter
@Entity
@Table(name = "auth_tokens")
public class AuthToken {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String token;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Column(nullable = false) private Instant expiresAt;
    @Column(nullable = false) private Instant createdAt = Instant.now();
    @Column(nullable = false) private boolean revoked = false;

    public boolean isActiveAt(Instant now) {
        return !revoked && expiresAt != null && expiresAt.isAfter(now);
    }
}
