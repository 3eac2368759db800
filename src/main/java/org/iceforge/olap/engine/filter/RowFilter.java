package org.iceforge.olap.engine.filter;

import org.iceforge.olap.data.CellValues;
import org.iceforge.olap.data.ColumnKind;
import org.iceforge.olap.data.NullOrdering;
import org.iceforge.olap.error.InvalidArgumentException;
import org.iceforge.olap.error.MalformedInputException;
import org.iceforge.olap.semantic.FieldRef;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * One condition on one input column, evaluated per row.
 * <p>
 * Operands are converted to the column kind up front: numeric strings for number columns, ISO-8601 strings for
 * timestamp columns. A NULL cell satisfies only {@link FilterOperator#IS_NULL}; every comparison, including
 * {@code !=} and {@code not in}, is false for it.
 */
public final class RowFilter implements Predicate<List<Object>> {

    private final FieldRef field;
    private final FilterOperator operator;
    private final List<Object> operands;

    private RowFilter(FieldRef field, FilterOperator operator, List<Object> operands) {
        this.field = field;
        this.operator = operator;
        this.operands = operands;
    }

    /**
     * @param value scalar operand, or a collection for {@code in}, {@code not in} and {@code between}; a scalar is
     *              also accepted for {@code in} and {@code not in}
     */
    public static RowFilter of(FieldRef field, FilterOperator operator, Object value) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        List<Object> raw = new ArrayList<>();
        if (value instanceof Collection<?> c) {
            raw.addAll(c);
        } else if (value != null) {
            raw.add(value);
        }
        int arity = operator.arity();
        if (arity == 1 && value instanceof Collection) {
            throw new InvalidArgumentException("Filter '" + field.name() + " " + operator.symbol()
                    + "' takes a single value, not a list");
        }
        if (arity == -1 ? raw.isEmpty() : raw.size() != arity) {
            String expected = arity == -1 ? "at least one value" : arity == 0 ? "no value" : arity + " value(s)";
            throw new InvalidArgumentException("Filter '" + field.name() + " " + operator.symbol() + "' takes "
                    + expected + ", got " + raw.size());
        }
        List<Object> operands = new ArrayList<>(raw.size());
        for (Object o : raw) {
            if (o == null) {
                throw new InvalidArgumentException("Filter '" + field.name() + " " + operator.symbol()
                        + "' has a null value; use 'is null' to match missing values");
            }
            operands.add(coerce(field, o));
        }
        return new RowFilter(field, operator, List.copyOf(operands));
    }

    public FieldRef field() {
        return field;
    }

    public FilterOperator operator() {
        return operator;
    }

    @Override
    public boolean test(List<Object> row) {
        Object cell = row.get(field.index());
        if (operator == FilterOperator.IS_NULL || operator == FilterOperator.IS_NOT_NULL) {
            return (cell == null) == (operator == FilterOperator.IS_NULL);
        }
        if (cell == null) {
            return false;
        }
        Object value = field.kind() == ColumnKind.TIMESTAMP ? CellValues.toTimestamp(cell) : cell;
        return switch (operator) {
            case EQ -> equal(value, operands.get(0));
            case NE -> !equal(value, operands.get(0));
            case GT -> compare(value, operands.get(0)) > 0;
            case GTE -> compare(value, operands.get(0)) >= 0;
            case LT -> compare(value, operands.get(0)) < 0;
            case LTE -> compare(value, operands.get(0)) <= 0;
            case IN -> anyEqual(value);
            case NOT_IN -> !anyEqual(value);
            case BETWEEN -> compare(value, operands.get(0)) >= 0 && compare(value, operands.get(1)) <= 0;
            default -> throw new IllegalStateException("Unhandled filter operator " + operator);
        };
    }

    private boolean anyEqual(Object value) {
        for (Object o : operands) {
            if (equal(value, o)) {
                return true;
            }
        }
        return false;
    }

    private static boolean equal(Object value, Object operand) {
        return CellValues.matches(value, operand) || CellValues.compare(value, operand, NullOrdering.LAST) == 0;
    }

    private static int compare(Object value, Object operand) {
        return CellValues.compare(value, operand, NullOrdering.LAST);
    }

    private static Object coerce(FieldRef field, Object operand) {
        switch (field.kind()) {
            case NUMBER:
                if (operand instanceof Number) {
                    return operand;
                }
                try {
                    return Double.parseDouble(operand.toString().trim());
                } catch (NumberFormatException e) {
                    throw new InvalidArgumentException("Filter on '" + field.name() + "' expects a number, got '"
                            + operand + "'", e);
                }
            case TIMESTAMP:
                try {
                    return CellValues.toTimestamp(operand);
                } catch (MalformedInputException e) {
                    throw new InvalidArgumentException("Filter on '" + field.name() + "' expects a date, got '"
                            + operand + "'", e);
                }
            case STRING:
                return operand instanceof String ? operand : operand.toString();
            case BOOLEAN:
                if (operand instanceof Boolean) {
                    return operand;
                }
                String s = operand.toString().trim();
                if (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false")) {
                    return Boolean.parseBoolean(s);
                }
                throw new InvalidArgumentException("Filter on '" + field.name() + "' expects true or false, got '"
                        + operand + "'");
            default:
                return operand;
        }
    }

    @Override
    public String toString() {
        return field.name() + " " + operator.symbol() + " " + operands;
    }
}
