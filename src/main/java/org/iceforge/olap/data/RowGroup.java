package org.iceforge.olap.data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Grouping metadata attached to every output row. Fields that do not apply to the producing operation are null.
 *
 * @param kind          detail, subtotal, grand total or gap-filled bucket
 * @param subtotalLevel number of grouped dimensions (0 = grand total), rollup/cube/grouping sets only
 * @param groupedBy     dimensions that carry real values in this row
 * @param collapsed     dimensions rendered as NULL because they were aggregated away
 * @param groupingSet   index of the grouping set that produced the row
 * @param bucket        truncated time bucket of a time-series row
 * @param rank          position assigned by ranking or Top-N operations (1-based)
 * @param paretoClass   A/B/C contribution class
 */
public record RowGroup(RowKind kind,
                       Integer subtotalLevel,
                       List<String> groupedBy,
                       List<String> collapsed,
                       Integer groupingSet,
                       LocalDateTime bucket,
                       Long rank,
                       String paretoClass) {

    public static final RowGroup DETAIL = new RowGroup(RowKind.DETAIL, null, List.of(), List.of(), null, null, null, null);

    public RowGroup {
        Objects.requireNonNull(kind, "kind");
        groupedBy = groupedBy == null ? List.of() : List.copyOf(groupedBy);
        collapsed = collapsed == null ? List.of() : List.copyOf(collapsed);
    }

    public static RowGroup grouping(List<String> groupedBy, List<String> collapsed, Integer groupingSet) {
        RowKind kind = groupedBy.isEmpty() ? RowKind.GRAND_TOTAL
                : collapsed.isEmpty() ? RowKind.DETAIL : RowKind.SUBTOTAL;
        return new RowGroup(kind, groupedBy.size(), groupedBy, collapsed, groupingSet, null, null, null);
    }

    public static RowGroup total(RowKind kind) {
        return new RowGroup(kind, null, List.of(), List.of(), null, null, null, null);
    }

    public static RowGroup bucket(LocalDateTime bucket, boolean filled) {
        return new RowGroup(filled ? RowKind.FILLED : RowKind.DETAIL, null, List.of(), List.of(), null, bucket, null, null);
    }

    public static RowGroup ranked(long rank, String paretoClass) {
        return new RowGroup(RowKind.DETAIL, null, List.of(), List.of(), null, null, rank, paretoClass);
    }

    /**
     * Same grouping with a rank attached, used when a ranking window runs over already grouped rows.
     */
    public RowGroup withRank(long rank) {
        return new RowGroup(kind, subtotalLevel, groupedBy, collapsed, groupingSet, bucket, rank, paretoClass);
    }

    public boolean isTotal() {
        return kind == RowKind.SUBTOTAL || kind == RowKind.GRAND_TOTAL;
    }
}
