package com.makeithappen.backend.goals.repo;

import com.makeithappen.backend.goals.entity.Plan;
import com.makeithappen.backend.goals.model.PlanStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PlanRepository extends JpaRepository<Plan, String> {

    List<Plan> findByUserIdAndStatus(String userId, PlanStatus status);

    Optional<Plan> findFirstByUserIdAndStatusOrderByCreatedAtDesc(String userId, PlanStatus status);

    List<Plan> findTop100ByUserIdOrderByCreatedAtDesc(String userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Plan p set p.status = :archived where p.userId = :userId and p.status <> :archived")
    int archiveAllForUser(@Param("userId") String userId, @Param("archived") PlanStatus archived);
}
