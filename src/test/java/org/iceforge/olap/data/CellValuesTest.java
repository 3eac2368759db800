package org.iceforge.olap.data;

import org.iceforge.olap.error.MalformedInputException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CellValuesTest {

    @Test
    void normalizesBoxedNumbers() {
        assertThat(CellValues.normalize(3)).isEqualTo(3L);
        assertThat(CellValues.normalize((short) 3)).isEqualTo(3L);
        assertThat(CellValues.normalize(new BigDecimal("1.5"))).isEqualTo(1.5);
        assertThat(CellValues.normalize("x")).isEqualTo("x");
        assertThat(CellValues.normalize(null)).isNull();
    }

    @Test
    void parsesTimestampStrings() {
        assertThat(CellValues.toTimestamp("2024")).isEqualTo(LocalDateTime.of(2024, 1, 1, 0, 0));
        assertThat(CellValues.toTimestamp("2024-03")).isEqualTo(LocalDateTime.of(2024, 3, 1, 0, 0));
        assertThat(CellValues.toTimestamp("2024-03-05")).isEqualTo(LocalDateTime.of(2024, 3, 5, 0, 0));
        assertThat(CellValues.toTimestamp("2024-03-05 10:15:00")).isEqualTo(LocalDateTime.of(2024, 3, 5, 10, 15));
        assertThat(CellValues.toTimestamp("2024-03-05T10:15:00+02:00"))
                .isEqualTo(LocalDateTime.of(2024, 3, 5, 8, 15));
    }

    @Test
    void convertsTemporalValuesToUtc() {
        assertThat(CellValues.toTimestamp(LocalDate.of(2024, 2, 29))).isEqualTo(LocalDateTime.of(2024, 2, 29, 0, 0));
        assertThat(CellValues.toTimestamp(OffsetDateTime.of(2024, 1, 1, 1, 0, 0, 0, ZoneOffset.ofHours(3))))
                .isEqualTo(LocalDateTime.of(2023, 12, 31, 22, 0));
    }

    @Test
    void malformedValuesAreRejected() {
        assertThatThrownBy(() -> CellValues.toTimestamp("yesterday")).isInstanceOf(MalformedInputException.class);
        assertThatThrownBy(() -> CellValues.toTimestamp(42)).isInstanceOf(MalformedInputException.class);
        assertThatThrownBy(() -> CellValues.toDouble("12")).isInstanceOf(MalformedInputException.class);
    }

    @Test
    void filterMatchingAcrossTypes() {
        assertThat(CellValues.matches(2024, 2024L)).isTrue();
        assertThat(CellValues.matches(2024, "2024")).isTrue();
        assertThat(CellValues.matches(1.0, 1)).isTrue();
        assertThat(CellValues.matches(null, null)).isTrue();
        assertThat(CellValues.matches("East", null)).isFalse();
        assertThat(CellValues.matches("East", "east")).isFalse();
    }

    @Test
    void nullsSortAccordingToOrdering() {
        List<Object> values = new ArrayList<>(Arrays.asList("b", null, "a"));

        values.sort(CellValues.comparator(NullOrdering.LAST));
        assertThat(values).containsExactly("a", "b", null);

        values.sort(CellValues.comparator(NullOrdering.FIRST));
        assertThat(values).containsExactly(null, "a", "b");
    }

    @Test
    void numbersCompareByValueAcrossTypes() {
        assertThat(CellValues.compare(2, 10L, NullOrdering.LAST)).isNegative();
        assertThat(CellValues.compare(2.0, 2, NullOrdering.LAST)).isZero();
    }

    @Test
    void keysCompareElementWise() {
        var cmp = CellValues.keyComparator(NullOrdering.LAST);

        assertThat(cmp.compare(List.of("a", 2L), List.of("a", 10L))).isNegative();
        assertThat(cmp.compare(Arrays.asList("a", null), List.of("a", 1L))).isPositive();
    }
}
