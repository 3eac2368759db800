package org.iceforge.olap.engine.aggregate;

import org.iceforge.olap.data.CellValues;
import org.iceforge.olap.data.NullOrdering;
import org.iceforge.olap.semantic.AggregationFunction;

import java.util.Set;
import java.util.TreeSet;

/**
 * Running state of one measure within one group. NULL inputs are ignored by every function.
 */
final class Accumulator {

    private final AggregationFunction function;
    private double sum;
    private long count;
    private Set<Object> distinct;
    private Object extreme;

    Accumulator(AggregationFunction function) {
        this.function = function;
        if (function == AggregationFunction.COUNT_DISTINCT) {
            // numbers compare by value, so 1 and 1.0 count once
            distinct = new TreeSet<>(CellValues.comparator(NullOrdering.LAST));
        }
    }

    void add(Object value) {
        if (value == null) {
            return;
        }
        switch (function) {
            case SUM, AVG -> {
                sum += CellValues.toDouble(value);
                count++;
            }
            case COUNT -> count++;
            case COUNT_DISTINCT -> distinct.add(value);
            case MIN -> {
                if (extreme == null || CellValues.compare(value, extreme, NullOrdering.LAST) < 0) {
                    extreme = value;
                }
            }
            case MAX -> {
                if (extreme == null || CellValues.compare(value, extreme, NullOrdering.LAST) > 0) {
                    extreme = value;
                }
            }
        }
    }

    /**
     * Final value. Over zero non-NULL inputs sum and counts are 0, average and extremes are NULL.
     */
    Object result() {
        return switch (function) {
            case SUM -> sum;
            case COUNT -> count;
            case COUNT_DISTINCT -> (long) distinct.size();
            case AVG -> count == 0 ? null : sum / count;
            case MIN, MAX -> extreme instanceof Number ? CellValues.normalize(extreme) : extreme;
        };
    }
}
