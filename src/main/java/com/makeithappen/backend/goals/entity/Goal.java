package com.makeithappen.backend.goals.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "goals",
        indexes = @Index(name = "idx_goals_user", columnList = "user_id"))
public class Goal {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "user_id", length = 36, nullable = false)
    private String userId;

    @Column(name = "raw_text", columnDefinition = "TEXT", nullable = false)
    private String rawText;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "image_refs", columnDefinition = "JSON", nullable = false)
    private List<String> imageRefs = new ArrayList<>();

    @Column(nullable = false, length = 32)
    private String timeline;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAt == null) createdAt = Instant.now();
        if (imageRefs == null) imageRefs = new ArrayList<>();
    }
}
