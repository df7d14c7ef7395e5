package com.makeithappen.backend.daily.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One concrete action for one focus area on one logical day.
 * {@code rescheduledFrom} is null for freshly generated rows and holds the source day for carried rows.
 */
@Getter
@Setter
@Entity
@Table(name = "daily_actions",
        indexes = {
                @Index(name = "idx_daily_actions_user_day", columnList = "user_id,action_day"),
                @Index(name = "idx_daily_actions_plan_day", columnList = "plan_id,action_day")
        }
)
public class DailyAction {

    @Id
    @Column(length = 36, nullable = false)
    private String id;

    @Column(name = "user_id", length = 36, nullable = false)
    private String userId;

    @Column(name = "plan_id", length = 36, nullable = false)
    private String planId;

    @Column(name = "focus_area", length = 128, nullable = false)
    private String focusArea;

    @Column(name = "action_text", columnDefinition = "TEXT", nullable = false)
    private String actionText;

    @Column(name = "action_day", nullable = false)
    private LocalDate day;

    @Column(nullable = false)
    private boolean completed = false;

    @Column(name = "completed_at_utc")
    private Instant completedAt;

    @Column(name = "rescheduled_from")
    private LocalDate rescheduledFrom;

    @PrePersist
    void prePersist() {
        if (id == null || id.isBlank()) id = UUID.randomUUID().toString();
    }

    public static DailyAction fresh(String userId, String planId, String focusArea, String actionText, LocalDate day) {
        DailyAction a = new DailyAction();
        a.setUserId(userId);
        a.setPlanId(planId);
        a.setFocusArea(focusArea);
        a.setActionText(actionText);
        a.setDay(day);
        return a;
    }

    /** Copy of an unfinished row moved onto {@code day}; completion state is reset. */
    public static DailyAction carriedFrom(DailyAction source, LocalDate day) {
        DailyAction a = fresh(source.getUserId(), source.getPlanId(), source.getFocusArea(), source.getActionText(), day);
        a.setRescheduledFrom(source.getDay());
        return a;
    }

    public boolean isCarried() {
        return rescheduledFrom != null;
    }
}
