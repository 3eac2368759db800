package org.iceforge.olap.semantic;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Optional;

/**
 * Time bucketing resolution. Declaration order is the fixed total order, coarsest first:
 * year > quarter > month > week > day > hour.
 */
public enum TimeGrain {
    YEAR,
    QUARTER,
    MONTH,
    WEEK,
    DAY,
    HOUR;

    public static Optional<TimeGrain> parse(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (TimeGrain g : values()) {
            if (g.name().equals(normalized)) {
                return Optional.of(g);
            }
        }
        return Optional.empty();
    }

    public boolean isCoarserThan(TimeGrain other) {
        return ordinal() < other.ordinal();
    }

    /**
     * Start of the bucket containing {@code t}. Weeks follow ISO-8601 and start on Monday, quarters start in
     * January, April, July and October.
     */
    public LocalDateTime truncate(LocalDateTime t) {
        return switch (this) {
            case YEAR -> t.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1);
            case QUARTER -> {
                int firstMonth = ((t.getMonthValue() - 1) / 3) * 3 + 1;
                yield t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).withMonth(firstMonth);
            }
            case MONTH -> t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
            case WEEK -> t.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case DAY -> t.truncatedTo(ChronoUnit.DAYS);
            case HOUR -> t.truncatedTo(ChronoUnit.HOURS);
        };
    }

    /**
     * Moves a bucket start by {@code amount} buckets, negative amounts move backwards.
     */
    public LocalDateTime plus(LocalDateTime bucket, long amount) {
        return switch (this) {
            case YEAR -> bucket.plusYears(amount);
            case QUARTER -> bucket.plusMonths(3 * amount);
            case MONTH -> bucket.plusMonths(amount);
            case WEEK -> bucket.plusWeeks(amount);
            case DAY -> bucket.plusDays(amount);
            case HOUR -> bucket.plusHours(amount);
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
