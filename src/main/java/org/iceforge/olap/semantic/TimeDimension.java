package org.iceforge.olap.semantic;

import java.util.List;
import java.util.Objects;

public record TimeDimension(String dimension, List<TimeGrain> grains) {

    public TimeDimension {
        Objects.requireNonNull(dimension, "dimension");
        grains = List.copyOf(grains);
    }

    public boolean supports(TimeGrain grain) {
        return grains.isEmpty() || grains.contains(grain);
    }
}
