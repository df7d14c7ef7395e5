package com.makeithappen.backend.daily.generator;

import com.makeithappen.backend.daily.entity.DailyAction;

/** Detached view of a previous-day row of one focus area, safe to hand to generator threads. */
public record YesterdayAction(String action, boolean completed) {

    public static YesterdayAction of(DailyAction a) {
        return new YesterdayAction(a.getActionText(), a.isCompleted());
    }
}
