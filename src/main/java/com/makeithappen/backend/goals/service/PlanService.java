package com.makeithappen.backend.goals.service;

import com.makeithappen.backend.daily.entity.DailyAction;
import com.makeithappen.backend.daily.repo.DailyActionRepository;
import com.makeithappen.backend.daily.time.DayResolver;
import com.makeithappen.backend.goals.dto.GoalDtos;
import com.makeithappen.backend.goals.entity.Goal;
import com.makeithappen.backend.goals.entity.Plan;
import com.makeithappen.backend.goals.model.FocusArea;
import com.makeithappen.backend.goals.model.PlanStatus;
import com.makeithappen.backend.goals.repo.GoalRepository;
import com.makeithappen.backend.goals.repo.PlanRepository;
import com.makeithappen.backend.daily.generator.FallbackActions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
@Service
public class PlanService {

    private final GoalRepository goals;
    private final PlanRepository plans;
    private final DailyActionRepository actions;
    private final DayResolver days;

    /**
     * Persists goal, active plan and one seeded fresh action per focus area for today.
     * The seeded rows make the fresh-action step a no-op for the rest of the day.
     */
    @Transactional
    public GoalDtos.GoalDumpResponse createPlan(String userId, String text, List<String> images,
                                                String timeline, List<FocusArea> focusAreas) {
        Goal goal = new Goal();
        goal.setUserId(userId);
        goal.setRawText(text);
        goal.setImageRefs(images == null ? new ArrayList<>() : new ArrayList<>(images));
        goal.setTimeline(timeline);
        goals.save(goal);

        Plan plan = new Plan();
        plan.setUserId(userId);
        plan.setGoalId(goal.getId());
        plan.setFocusAreas(new ArrayList<>(focusAreas));
        plan.setTimeline(timeline);
        plan.setStatus(PlanStatus.ACTIVE);
        plans.save(plan);

        LocalDate today = days.today();
        List<DailyAction> seeds = focusAreas.stream()
                .map(a -> DailyAction.fresh(userId, plan.getId(), a.name(),
                        a.dailyActionSeed().isBlank() ? FallbackActions.SAFE_DEFAULT : a.dailyActionSeed(), today))
                .toList();
        actions.saveAll(seeds);

        log.info("plan_created userId={} goalId={} planId={} focusAreas={}",
                userId, goal.getId(), plan.getId(), focusAreas.size());
        return new GoalDtos.GoalDumpResponse(goal.getId(), plan.getId(), plan.getFocusAreas());
    }

    @Transactional(readOnly = true)
    public Optional<Plan> current(String userId) {
        return plans.findFirstByUserIdAndStatusOrderByCreatedAtDesc(userId, PlanStatus.ACTIVE);
    }

    @Transactional(readOnly = true)
    public List<Plan> list(String userId) {
        return plans.findTop100ByUserIdOrderByCreatedAtDesc(userId);
    }

    /** Archives every live plan and wipes the user's action history in one transaction. */
    @Transactional
    public GoalDtos.StartFreshResponse startFresh(String userId) {
        int archived = plans.archiveAllForUser(userId, PlanStatus.ARCHIVED);
        int deleted = actions.deleteAllByUserId(userId);
        log.info("start_fresh userId={} archivedPlans={} deletedActions={}", userId, archived, deleted);
        return new GoalDtos.StartFreshResponse(true, archived, deleted);
    }
}
