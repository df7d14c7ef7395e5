package com.makeithappen.backend.goals.entity;

import com.makeithappen.backend.goals.model.FocusArea;
import com.makeithappen.backend.goals.model.PlanStatus;
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
@Table(name = "plans",
        indexes = @Index(name = "idx_plans_user_status", columnList = "user_id,status"))
public class Plan {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "user_id", length = 36, nullable = false)
    private String userId;

    @Column(name = "goal_id", length = 36, nullable = false)
    private String goalId;

    // ordered; FocusArea.name is the key daily actions refer to
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "focus_areas", columnDefinition = "JSON", nullable = false)
    private List<FocusArea> focusAreas = new ArrayList<>();

    @Column(nullable = false, length = 32)
    private String timeline;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PlanStatus status = PlanStatus.ACTIVE;

    @Column(name = "created_at_utc", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
        if (createdAt == null) createdAt = Instant.now();
        if (status == null) status = PlanStatus.ACTIVE;
    }

    public List<FocusArea> getFocusAreas() {
        return focusAreas == null ? List.of() : focusAreas;
    }
}
