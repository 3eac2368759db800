package org.iceforge.olap.data;

import org.iceforge.olap.error.MalformedInputException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Date;
import java.util.List;

/**
 * Conversions and ordering shared by every engine.
 */
public final class CellValues {

    private CellValues() {
    }

    /**
     * Brings equal numbers of different boxed types onto one representation so they land in the same group.
     */
    public static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        if (value instanceof Float || value instanceof BigDecimal) {
            return ((Number) value).doubleValue();
        }
        return value;
    }

    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new MalformedInputException("Expected a numeric value but got '" + value + "' ("
                + value.getClass().getSimpleName() + ")");
    }

    /**
     * Reads a timestamp cell. Strings are parsed as ISO-8601 year, year-month, date or date-time.
     */
    public static LocalDateTime toTimestamp(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime t) {
            return t;
        }
        if (value instanceof LocalDate d) {
            return d.atStartOfDay();
        }
        if (value instanceof OffsetDateTime t) {
            return t.atZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime t) {
            return t.withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
        if (value instanceof Instant i) {
            return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
        }
        if (value instanceof YearMonth ym) {
            return ym.atDay(1).atStartOfDay();
        }
        if (value instanceof Year y) {
            return y.atDay(1).atStartOfDay();
        }
        if (value instanceof Date d) {
            return LocalDateTime.ofInstant(d.toInstant(), ZoneOffset.UTC);
        }
        if (value instanceof String s) {
            return parseTimestamp(s.trim());
        }
        throw new MalformedInputException("Expected a timestamp but got '" + value + "' ("
                + value.getClass().getSimpleName() + ")");
    }

    /**
     * Whether {@link #toTimestamp} can read the value without parsing, i.e. it is one of the supported date and
     * time types.
     */
    public static boolean isTimestamp(Object value) {
        return value instanceof LocalDateTime || value instanceof LocalDate || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime || value instanceof Instant || value instanceof YearMonth
                || value instanceof Year || value instanceof Date;
    }

    private static LocalDateTime parseTimestamp(String s) {
        try {
            switch (s.length()) {
                case 4:
                    return Year.parse(s).atDay(1).atStartOfDay();
                case 7:
                    return YearMonth.parse(s).atDay(1).atStartOfDay();
                case 10:
                    return LocalDate.parse(s).atStartOfDay();
                default:
                    if (s.endsWith("Z") || s.matches(".*[+-]\\d{2}:\\d{2}$")) {
                        return OffsetDateTime.parse(s).atZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
                    }
                    return LocalDateTime.parse(s.replace(' ', 'T'));
            }
        } catch (DateTimeParseException e) {
            throw new MalformedInputException("Cannot parse timestamp '" + s + "'", e);
        }
    }

    /**
     * Equality used by dimension filters: numbers compare by value, everything else by {@code equals} on the
     * normalized value, falling back to the string form so "2024" matches 2024.
     */
    public static boolean matches(Object cell, Object wanted) {
        if (cell == null || wanted == null) {
            return cell == null && wanted == null;
        }
        if (cell instanceof Number a && wanted instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        if (normalize(cell).equals(normalize(wanted))) {
            return true;
        }
        return cell.toString().equals(wanted.toString());
    }

    public static Comparator<Object> comparator(NullOrdering nulls) {
        return (a, b) -> compare(a, b, nulls);
    }

    public static Comparator<List<Object>> keyComparator(NullOrdering nulls) {
        return (a, b) -> {
            int n = Math.min(a.size(), b.size());
            for (int i = 0; i < n; i++) {
                int c = compare(a.get(i), b.get(i), nulls);
                if (c != 0) {
                    return c;
                }
            }
            return Integer.compare(a.size(), b.size());
        };
    }

    public static int compare(Object a, Object b, NullOrdering nulls) {
        if (a == null || b == null) {
            if (a == b) {
                return 0;
            }
            int nullFirst = a == null ? -1 : 1;
            return nulls == NullOrdering.FIRST ? nullFirst : -nullFirst;
        }
        int ra = typeRank(a);
        int rb = typeRank(b);
        if (ra != rb) {
            return Integer.compare(ra, rb);
        }
        switch (ra) {
            case 0:
                return ((Boolean) a).compareTo((Boolean) b);
            case 1:
                return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
            case 2:
                return ((String) a).compareTo((String) b);
            case 3:
                return toTimestamp(a).compareTo(toTimestamp(b));
            default:
                return compareOther(a, b);
        }
    }

    /**
     * Values outside the supported cell types have no natural order here; their string forms give a stable one.
     */
    private static int compareOther(Object a, Object b) {
        int c = a.getClass().getName().compareTo(b.getClass().getName());
        return c != 0 ? c : a.toString().compareTo(b.toString());
    }

    private static int typeRank(Object value) {
        if (value instanceof Boolean) {
            return 0;
        }
        if (value instanceof Number) {
            return 1;
        }
        if (value instanceof String) {
            return 2;
        }
        if (isTimestamp(value)) {
            return 3;
        }
        return 4;
    }
}
