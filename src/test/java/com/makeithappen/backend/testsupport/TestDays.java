package com.makeithappen.backend.testsupport;

import com.makeithappen.backend.daily.config.DailyScheduleProperties;
import com.makeithappen.backend.daily.time.DayResolver;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/** Fixed-clock helpers. Default instant is 2026-03-10 13:00 in Chicago, a Tuesday. */
public final class TestDays {

    public static final Instant NOW = Instant.parse("2026-03-10T18:00:00Z");
    public static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    private TestDays() {}

    public static DailyScheduleProperties props(int aiMaxConcurrency) {
        return new DailyScheduleProperties("America/Chicago", 5, aiMaxConcurrency);
    }

    public static DayResolver resolver() {
        return resolverAt(NOW);
    }

    public static DayResolver resolverAt(Instant now) {
        return new DayResolver(props(4), Clock.fixed(now, ZoneOffset.UTC));
    }
}
