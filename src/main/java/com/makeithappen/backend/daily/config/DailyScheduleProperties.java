package com.makeithappen.backend.daily.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Process-wide day boundary and generation settings, read once at startup.
 *
 * @param timezone         IANA zone the logical day is computed in
 * @param rolloverHour     local hour (0-23) at which "today" flips
 * @param aiMaxConcurrency max generator calls in flight per fresh-action batch
 */
@Validated
@ConfigurationProperties(prefix = "app.daily")
public record DailyScheduleProperties(
        @DefaultValue("America/Chicago") @NotBlank String timezone,
        @DefaultValue("5") @Min(0) @Max(23) int rolloverHour,
        @DefaultValue("4") @Min(1) int aiMaxConcurrency
) {

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }
}
