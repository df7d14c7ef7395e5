package com.makeithappen.backend.goals.repo;

import com.makeithappen.backend.goals.entity.Goal;
import org.springframework.data.jpa.repository.JpaRepository;

public interface GoalRepository extends JpaRepository<Goal, String> {
}
