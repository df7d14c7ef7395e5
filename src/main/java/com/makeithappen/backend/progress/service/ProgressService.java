package com.makeithappen.backend.progress.service;

import com.makeithappen.backend.daily.dto.DailyDtos;
import com.makeithappen.backend.daily.entity.DailyAction;
import com.makeithappen.backend.daily.repo.DailyActionRepository;
import com.makeithappen.backend.daily.time.DayResolver;
import com.makeithappen.backend.progress.dto.ProgressDtos.FocusAreaProgress;
import com.makeithappen.backend.progress.dto.ProgressDtos.ProgressResponse;
import com.makeithappen.backend.progress.dto.ProgressDtos.StreakResponse;
import com.makeithappen.backend.progress.dto.ProgressDtos.WeeklySummaryResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.*;

/**
 * Read-only aggregations over daily action history.
 */
@RequiredArgsConstructor
@Service
public class ProgressService {

    static final int STREAK_WINDOW = 2000;
    static final int MAX_WINS = 5;
    static final int PROGRESS_DAYS = 30;

    private final DailyActionRepository actions;
    private final DayResolver days;

    @Transactional(readOnly = true)
    public StreakResponse calculateStreak(String userId) {
        List<LocalDate> completedDays = actions.findCompletedDays(userId, PageRequest.of(0, STREAK_WINDOW));
        if (completedDays.isEmpty()) {
            return new StreakResponse(0, 0, 0, "Start your first action to begin your journey!");
        }

        List<LocalDate> unique = new ArrayList<>(new TreeSet<>(completedDays).descendingSet());
        LocalDate today = days.today();

        int current = 0;
        for (int i = 0; i < unique.size(); i++) {
            if (!unique.get(i).equals(today.minusDays(i))) break;
            current++;
        }

        int longest = 1;
        int run = 1;
        for (int i = 0; i + 1 < unique.size(); i++) {
            if (ChronoUnit.DAYS.between(unique.get(i + 1), unique.get(i)) == 1) {
                run++;
                longest = Math.max(longest, run);
            } else {
                run = 1;
            }
        }
        longest = Math.max(longest, current);

        return new StreakResponse(current, longest, completedDays.size(), streakMessage(current));
    }

    static String streakMessage(int current) {
        if (current == 0) return "Tomorrow is a fresh start! 🌱";
        if (current == 1) return "One day at a time! Keep going 🌟";
        if (current < 7) return current + " days of small steps! You're building something beautiful 🌸";
        if (current < 30) return current + " days of showing up! This is becoming who you are 💫";
        return current + " days of gentle progress! You're amazing 🌈";
    }

    @Transactional(readOnly = true)
    public WeeklySummaryResponse weeklySummary(String userId) {
        LocalDate today = days.today();
        LocalDate weekStart = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate weekEnd = weekStart.plusDays(6);

        List<DailyAction> week = actions.findByUserIdAndDayBetween(userId, weekStart, weekEnd);

        int total = week.size();
        int completed = (int) week.stream().filter(DailyAction::isCompleted).count();
        double rate = percent(completed, total);

        // insertion order = first appearance in the week
        Map<String, int[]> byArea = new LinkedHashMap<>();
        for (DailyAction a : week) {
            int[] c = byArea.computeIfAbsent(a.getFocusArea(), k -> new int[2]);
            c[1]++;
            if (a.isCompleted()) c[0]++;
        }
        List<FocusAreaProgress> perArea = byArea.entrySet().stream()
                .map(e -> new FocusAreaProgress(e.getKey(), e.getValue()[0], e.getValue()[1],
                        round1(percent(e.getValue()[0], e.getValue()[1]))))
                .toList();

        List<String> wins = week.stream()
                .filter(DailyAction::isCompleted)
                .limit(MAX_WINS)
                .map(a -> a.getFocusArea() + ": " + a.getActionText())
                .toList();

        return new WeeklySummaryResponse(weekStart, weekEnd, total, completed, round1(rate),
                perArea, wins, momentumMessage(rate, completed));
    }

    static String momentumMessage(double rate, int completed) {
        if (rate >= 80) return "Incredible momentum this week! " + completed + " actions completed — you're moving 🚀";
        if (rate >= 60) return "Solid week! " + completed + " actions done. Keep stacking wins 🌟";
        if (rate >= 40) return "You showed up " + completed + " times this week. That counts 🌱";
        if (rate > 0) return completed + " small steps this week. Progress > perfection 💚";
        return "New week, fresh start! Your goals are waiting 🌅";
    }

    @Transactional(readOnly = true)
    public ProgressResponse recentProgress(String userId) {
        LocalDate cutoff = days.today().minusDays(PROGRESS_DAYS);
        List<DailyAction> recent = actions.findByUserIdAndDayGreaterThanEqualOrderByDayAsc(userId, cutoff);

        int total = recent.size();
        int completed = (int) recent.stream().filter(DailyAction::isCompleted).count();

        return new ProgressResponse(total, completed, round1(percent(completed, total)),
                recent.stream().map(DailyDtos.DailyActionDto::of).toList());
    }

    private static double percent(int part, int whole) {
        return whole == 0 ? 0.0 : part * 100.0 / whole;
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
