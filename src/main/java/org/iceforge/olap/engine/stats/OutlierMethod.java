package org.iceforge.olap.engine.stats;

import java.util.Locale;
import java.util.Optional;

public enum OutlierMethod {
    IQR(1.5),
    ZSCORE(3.0);

    private final double defaultThreshold;

    OutlierMethod(double defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    /**
     * Fence multiplier for {@link #IQR}, absolute z-score for {@link #ZSCORE}.
     */
    public double defaultThreshold() {
        return defaultThreshold;
    }

    public static Optional<OutlierMethod> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (OutlierMethod m : values()) {
            if (m.name().equals(normalized)) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
