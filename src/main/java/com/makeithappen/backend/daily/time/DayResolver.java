package com.makeithappen.backend.daily.time;

import com.makeithappen.backend.daily.config.DailyScheduleProperties;
import org.springframework.stereotype.Component;

import java.time.*;

/**
 * Maps an instant to the user-facing logical day.
 * Before {@code rolloverHour} local time the previous calendar date is still "today".
 */
@Component
public class DayResolver {

    private final ZoneId zone;
    private final int rolloverHour;
    private final Clock clock;

    public DayResolver(DailyScheduleProperties props, Clock clock) {
        this.zone = props.zoneId();
        this.rolloverHour = props.rolloverHour();
        this.clock = clock;
    }

    public LocalDate effectiveDay(Instant now) {
        ZonedDateTime local = ZonedDateTime.ofInstant(now, zone);
        LocalDate d = local.toLocalDate();
        if (local.getHour() < rolloverHour) d = d.minusDays(1);
        return d;
    }

    public LocalDate today() {
        return effectiveDay(clock.instant());
    }

    public Instant now() {
        return clock.instant();
    }
}
