package org.iceforge.olap.engine.timeseries;

import org.iceforge.olap.semantic.TimeGrain;

import java.util.Locale;
import java.util.Optional;

/**
 * Period-over-period comparisons. Each compares a bucket with the bucket one {@link #period()} earlier.
 */
public enum PeriodComparison {
    YOY(TimeGrain.YEAR),
    QOQ(TimeGrain.QUARTER),
    MOM(TimeGrain.MONTH),
    WOW(TimeGrain.WEEK),
    DOD(TimeGrain.DAY);

    private final TimeGrain period;

    PeriodComparison(TimeGrain period) {
        this.period = period;
    }

    public TimeGrain period() {
        return period;
    }

    /**
     * Accepts the short codes ({@code yoy}) and the spelled-out forms ({@code year_over_year}).
     */
    public static Optional<PeriodComparison> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (PeriodComparison c : values()) {
            if (c.name().equals(normalized)
                    || normalized.equals(c.period.name() + "_OVER_" + c.period.name())) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    public boolean supports(TimeGrain grain) {
        if (grain.isCoarserThan(period)) {
            return false;
        }
        return !(grain == TimeGrain.WEEK && (this == MOM || this == QOQ));
    }
}
