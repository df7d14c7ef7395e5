package com.makeithappen.backend.daily.service;

import com.makeithappen.backend.daily.entity.DailyAction;
import com.makeithappen.backend.daily.repo.DailyActionRepository;
import com.makeithappen.backend.daily.time.DayResolver;
import com.makeithappen.backend.daily.web.ActionNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
@Service
public class DailyActionService {

    // per focus area: carried rows first, then fresh
    private static final Comparator<DailyAction> TODAY_ORDER = Comparator
            .comparing(DailyAction::getFocusArea)
            .thenComparing(a -> !a.isCarried());

    private final DailyActionRepository actions;
    private final RolloverService rollover;
    private final FreshActionService freshActions;
    private final DayResolver days;

    /**
     * "View today": rollover, then fresh generation, then read. Each step commits on its own.
     */
    public List<DailyAction> today(String userId) {
        LocalDate today = days.today();

        rollover.rescheduleIncomplete(userId);
        freshActions.ensureFreshActions(userId);

        return actions.findByUserIdAndDay(userId, today).stream()
                .sorted(TODAY_ORDER)
                .toList();
    }

    @Transactional
    public void checkIn(String userId, String actionId, boolean completed) {
        Instant completedAt = completed ? days.now() : null;
        int updated = actions.updateCompletion(actionId, userId, completed, completedAt);
        if (updated == 0) throw new ActionNotFoundException(actionId);

        log.info("check_in userId={} actionId={} completed={}", userId, actionId, completed);
    }
}
