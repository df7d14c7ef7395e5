package com.makeithappen.backend.daily.service;

import com.makeithappen.backend.daily.config.DailyScheduleProperties;
import com.makeithappen.backend.daily.entity.DailyAction;
import com.makeithappen.backend.daily.generator.ActionGenerator;
import com.makeithappen.backend.daily.generator.FallbackActions;
import com.makeithappen.backend.daily.generator.YesterdayAction;
import com.makeithappen.backend.daily.repo.DailyActionRepository;
import com.makeithappen.backend.daily.time.DayResolver;
import com.makeithappen.backend.goals.entity.Plan;
import com.makeithappen.backend.goals.model.FocusArea;
import com.makeithappen.backend.goals.model.PlanStatus;
import com.makeithappen.backend.goals.repo.PlanRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.stream.Collectors;

/**
 * Makes sure every active plan has freshly generated actions for today.
 * Runs after {@link RolloverService}; carried rows do not count as fresh.
 */
@Slf4j
@Service
public class FreshActionService {

    private final DailyActionRepository actions;
    private final PlanRepository plans;
    private final ActionGenerator generator;
    private final DayResolver days;
    private final Executor executor;
    private final int maxConcurrency;
    private final TransactionTemplate readTx;
    private final TransactionTemplate writeTx;

    public FreshActionService(DailyActionRepository actions,
                              PlanRepository plans,
                              ActionGenerator generator,
                              DayResolver days,
                              DailyScheduleProperties props,
                              @Qualifier("actionGenerationExecutor") Executor executor,
                              PlatformTransactionManager txManager) {
        this.actions = actions;
        this.plans = plans;
        this.generator = generator;
        this.days = days;
        this.executor = executor;
        this.maxConcurrency = props.aiMaxConcurrency();

        this.readTx = new TransactionTemplate(txManager);
        this.readTx.setReadOnly(true);
        this.writeTx = new TransactionTemplate(txManager);
    }

    /**
     * Idempotent per logical day: plans that already own a fresh row for today are skipped
     * before any generation work starts.
     * <p>
     * Three steps: a short read-only unit, generation with no transaction (and no connection)
     * held, then one short write unit that re-checks and inserts.
     *
     * @return number of rows inserted
     */
    public int ensureFreshActions(String userId) {
        LocalDate today = days.today();

        List<Job> jobs = readTx.execute(status -> collectJobs(userId, today));
        if (jobs == null || jobs.isEmpty()) return 0;

        // new permit pool per batch: at most maxConcurrency generator calls in flight
        Semaphore permits = new Semaphore(maxConcurrency);
        List<CompletableFuture<String>> futures = jobs.stream().map(j -> submit(j, permits)).toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<DailyAction> rows = new ArrayList<>(jobs.size());
        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            rows.add(DailyAction.fresh(userId, job.planId(), job.area().name(), futures.get(i).join(), today));
        }

        Integer inserted = writeTx.execute(status -> insertMissing(userId, today, rows));
        return inserted == null ? 0 : inserted;
    }

    private List<Job> collectJobs(String userId, LocalDate today) {
        LocalDate yesterday = today.minusDays(1);

        List<Plan> active = plans.findByUserIdAndStatus(userId, PlanStatus.ACTIVE);
        if (active.isEmpty()) return List.of();

        List<String> activeIds = active.stream().map(Plan::getId).toList();
        Set<String> alreadyFresh = new HashSet<>(actions.findPlanIdsWithFreshAction(userId, today, activeIds));

        List<Plan> pending = active.stream().filter(p -> !alreadyFresh.contains(p.getId())).toList();
        if (pending.isEmpty()) return List.of();

        List<String> pendingIds = pending.stream().map(Plan::getId).toList();

        Map<String, List<DailyAction>> yesterdayByPlan = actions
                .findByUserIdAndDayAndPlanIdIn(userId, yesterday, pendingIds).stream()
                .collect(Collectors.groupingBy(DailyAction::getPlanId));

        Map<String, LocalDate> firstDayByPlan = new HashMap<>();
        for (DailyActionRepository.PlanFirstDay row : actions.findFirstDayByPlan(userId, pendingIds)) {
            if (row.getFirstDay() != null) firstDayByPlan.put(row.getPlanId(), row.getFirstDay());
        }

        List<Job> jobs = new ArrayList<>();
        for (Plan plan : pending) {
            LocalDate first = firstDayByPlan.get(plan.getId());
            int dayIndex = first == null ? 0 : (int) ChronoUnit.DAYS.between(first, today);
            List<DailyAction> planYesterday = yesterdayByPlan.getOrDefault(plan.getId(), List.of());

            for (FocusArea area : plan.getFocusAreas()) {
                List<YesterdayAction> forArea = planYesterday.stream()
                        .filter(a -> area.name().equals(a.getFocusArea()))
                        .map(YesterdayAction::of)
                        .toList();
                jobs.add(new Job(plan.getId(), plan.getTimeline(), area, forArea, dayIndex));
            }
        }
        return jobs;
    }

    /** Drops rows for plans another request filled while generation ran, then inserts the rest. */
    private int insertMissing(String userId, LocalDate today, List<DailyAction> rows) {
        Set<String> planIds = rows.stream().map(DailyAction::getPlanId).collect(Collectors.toSet());
        Set<String> filledMeanwhile = new HashSet<>(actions.findPlanIdsWithFreshAction(userId, today, planIds));

        List<DailyAction> toInsert = rows.stream()
                .filter(r -> !filledMeanwhile.contains(r.getPlanId()))
                .toList();

        if (!filledMeanwhile.isEmpty()) {
            log.info("fresh_actions_skip_filled userId={} day={} plans={}", userId, today, filledMeanwhile);
        }
        if (toInsert.isEmpty()) return 0;

        actions.saveAll(toInsert);
        log.info("fresh_actions_done userId={} day={} plans={} inserted={}",
                userId, today, planIds.size() - filledMeanwhile.size(), toInsert.size());
        return toInsert.size();
    }

    private CompletableFuture<String> submit(Job job, Semaphore permits) {
        try {
            return CompletableFuture.supplyAsync(() -> generateBounded(job, permits), executor)
                    .exceptionally(ex -> {
                        log.warn("fresh_action_job_failed planId={} focusArea={}; using safe default",
                                job.planId(), job.area().name(), ex);
                        return FallbackActions.SAFE_DEFAULT;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("fresh_action_job_rejected planId={} focusArea={}", job.planId(), job.area().name());
            return CompletableFuture.completedFuture(FallbackActions.nextAction(job.area(), job.dayIndex()));
        }
    }

    private String generateBounded(Job job, Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("GENERATION_INTERRUPTED", e);
        }
        try {
            String text = generator.generate(job.area(), job.yesterday(), job.dayIndex(), job.timeline());
            return (text == null || text.isBlank()) ? FallbackActions.SAFE_DEFAULT : text.strip();
        } finally {
            permits.release();
        }
    }

    private record Job(String planId, String timeline, FocusArea area, List<YesterdayAction> yesterday, int dayIndex) {}
}
