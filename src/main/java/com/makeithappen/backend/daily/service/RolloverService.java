package com.makeithappen.backend.daily.service;

import com.makeithappen.backend.daily.entity.DailyAction;
import com.makeithappen.backend.daily.repo.DailyActionRepository;
import com.makeithappen.backend.daily.time.DayResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Carries yesterday's unfinished actions into today, once per day transition.
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class RolloverService {

    private final DailyActionRepository actions;
    private final DayResolver days;

    /**
     * Idempotent per logical day: a second call finds the carried rows and returns 0.
     *
     * @return number of rows inserted
     */
    @Transactional
    public int rescheduleIncomplete(String userId) {
        LocalDate today = days.today();
        LocalDate yesterday = today.minusDays(1);

        if (actions.existsByUserIdAndDayAndRescheduledFrom(userId, today, yesterday)) {
            log.debug("rollover_skip_already_done userId={} day={}", userId, today);
            return 0;
        }

        List<DailyAction> incomplete = actions.findByUserIdAndDayAndCompletedFalse(userId, yesterday);
        if (incomplete.isEmpty()) return 0;

        // empty after the check above unless an earlier attempt partially landed
        Set<CarryKey> present = actions.findByUserIdAndDayAndRescheduledFrom(userId, today, yesterday).stream()
                .map(CarryKey::of)
                .collect(Collectors.toCollection(HashSet::new));

        List<DailyAction> toAdd = new ArrayList<>();
        for (DailyAction a : incomplete) {
            if (!present.add(CarryKey.of(a))) continue;
            toAdd.add(DailyAction.carriedFrom(a, today));
        }

        if (toAdd.isEmpty()) return 0;

        actions.saveAll(toAdd);
        log.info("rollover_done userId={} from={} to={} inserted={}", userId, yesterday, today, toAdd.size());
        return toAdd.size();
    }

    private record CarryKey(String planId, String focusArea, String actionText) {
        static CarryKey of(DailyAction a) {
            return new CarryKey(a.getPlanId(), a.getFocusArea(), a.getActionText());
        }
    }
}
