package com.meterly.api.usage.entities;

import lombok.NonNull;

import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Fixed calendar windows that metered requests are counted in. Windows are aligned to the
 * configured time zone, e.g. a daily window starts at local midnight.
 */
public enum UsageWindow {
    HOURLY,
    DAILY,
    MONTHLY;

    /**
     * @return start of the window that contains {@code now}.
     */
    @NonNull
    public OffsetDateTime windowStart(@NonNull ZonedDateTime now) {
        return truncate(now).toOffsetDateTime();
    }

    /**
     * @return start of the window that follows the window containing {@code now}, i.e. the time
     * when its counter resets.
     */
    @NonNull
    public OffsetDateTime nextReset(@NonNull ZonedDateTime now) {
        final ZonedDateTime start = truncate(now);
        switch (this) {
            case HOURLY:
                return start.plusHours(1).toOffsetDateTime();
            case DAILY:
                return start.plusDays(1).toOffsetDateTime();
            default:
                return start.plusMonths(1).toOffsetDateTime();
        }
    }

    @NonNull
    private ZonedDateTime truncate(@NonNull ZonedDateTime now) {
        switch (this) {
            case HOURLY:
                return now.truncatedTo(ChronoUnit.HOURS);
            case DAILY:
                return now.truncatedTo(ChronoUnit.DAYS);
            default:
                return now.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS);
        }
    }
}
