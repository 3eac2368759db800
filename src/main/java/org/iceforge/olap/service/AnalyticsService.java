package org.iceforge.olap.service;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.iceforge.olap.api.AggregateRequest;
import org.iceforge.olap.api.AnalyticsRequest;
import org.iceforge.olap.api.FilterCondition;
import org.iceforge.olap.api.GroupingSetsRequest;
import org.iceforge.olap.api.HistogramRequest;
import org.iceforge.olap.api.OutlierRequest;
import org.iceforge.olap.api.ParetoRequest;
import org.iceforge.olap.api.PivotRequest;
import org.iceforge.olap.api.StatisticsRequest;
import org.iceforge.olap.api.SubtotalRequest;
import org.iceforge.olap.api.TimeSeriesRequest;
import org.iceforge.olap.api.WindowCalculation;
import org.iceforge.olap.api.WindowRequest;
import org.iceforge.olap.config.OlapProperties;
import org.iceforge.olap.data.CellValues;
import org.iceforge.olap.data.ResultTable;
import org.iceforge.olap.data.RowSet;
import org.iceforge.olap.engine.aggregate.AggregationEngine;
import org.iceforge.olap.engine.aggregate.PercentageOf;
import org.iceforge.olap.engine.aggregate.PivotOptions;
import org.iceforge.olap.engine.filter.FilterOperator;
import org.iceforge.olap.engine.filter.RowFilter;
import org.iceforge.olap.engine.stats.HistogramSpec;
import org.iceforge.olap.engine.stats.OutlierMethod;
import org.iceforge.olap.engine.stats.ParetoSpec;
import org.iceforge.olap.engine.stats.StatisticsEngine;
import org.iceforge.olap.engine.timeseries.PeriodComparison;
import org.iceforge.olap.engine.timeseries.TimeSeriesEngine;
import org.iceforge.olap.engine.timeseries.TimeSeriesOptions;
import org.iceforge.olap.engine.window.SortKey;
import org.iceforge.olap.engine.window.WindowEngine;
import org.iceforge.olap.engine.window.WindowFunction;
import org.iceforge.olap.engine.window.WindowParams;
import org.iceforge.olap.error.InvalidArgumentException;
import org.iceforge.olap.error.MalformedInputException;
import org.iceforge.olap.semantic.Dataset;
import org.iceforge.olap.semantic.Dimension;
import org.iceforge.olap.semantic.DimensionKind;
import org.iceforge.olap.semantic.FieldRef;
import org.iceforge.olap.semantic.FieldResolver;
import org.iceforge.olap.semantic.MeasureRef;
import org.iceforge.olap.semantic.ResolvedQuery;
import org.iceforge.olap.semantic.TimeDimension;
import org.iceforge.olap.semantic.TimeGrain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Entry point of every analytics operation. Each call validates the request, takes the current semantic model
 * snapshot, applies dimension filters, resolves logical names against the input header and hands bound fields to
 * the engines.
 */
@Service
public class AnalyticsService {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyticsService.class);

    private final SemanticModelRegistry registry;
    private final FieldResolver resolver;
    private final AggregationEngine aggregationEngine;
    private final TimeSeriesEngine timeSeriesEngine;
    private final WindowEngine windowEngine;
    private final StatisticsEngine statisticsEngine;
    private final Validator validator;
    private final OlapProperties props;

    public AnalyticsService(SemanticModelRegistry registry,
                            FieldResolver resolver,
                            AggregationEngine aggregationEngine,
                            TimeSeriesEngine timeSeriesEngine,
                            WindowEngine windowEngine,
                            StatisticsEngine statisticsEngine,
                            Validator validator,
                            OlapProperties props) {
        this.registry = Objects.requireNonNull(registry);
        this.resolver = Objects.requireNonNull(resolver);
        this.aggregationEngine = Objects.requireNonNull(aggregationEngine);
        this.timeSeriesEngine = Objects.requireNonNull(timeSeriesEngine);
        this.windowEngine = Objects.requireNonNull(windowEngine);
        this.statisticsEngine = Objects.requireNonNull(statisticsEngine);
        this.validator = Objects.requireNonNull(validator);
        this.props = Objects.requireNonNull(props);
    }

    public ResultTable aggregate(String dataset, RowSet rows, AggregateRequest req) {
        return run("aggregate", dataset, rows, req, (ds, input) -> {
            List<String> groupBy = dimensions(ds, req.getGroupBy(), req.getHierarchy(), req.getHierarchyLevel());
            ResolvedQuery q = resolver.resolve(ds, input.getColumns(), groupBy, req.getMeasures());
            return aggregationEngine.aggregate(input, q.dimensions(), q.measures());
        });
    }

    public ResultTable pivot(String dataset, RowSet rows, PivotRequest req) {
        return run("pivot", dataset, rows, req, (ds, input) -> {
            List<String> rowDims = nullToEmpty(req.getRows());
            List<String> overlap = new ArrayList<>(rowDims);
            overlap.retainAll(req.getColumns());
            if (!overlap.isEmpty()) {
                throw new InvalidArgumentException("Pivot row and column dimensions overlap: " + overlap);
            }
            List<String> all = new ArrayList<>(rowDims);
            all.addAll(req.getColumns());
            ResolvedQuery q = resolver.resolve(ds, input.getColumns(), all, req.getMeasures());
            PercentageOf percentageOf = req.getPercentageOf() == null ? null
                    : PercentageOf.parse(req.getPercentageOf()).orElseThrow(() -> new InvalidArgumentException(
                    "Unknown percentage basis '" + req.getPercentageOf() + "'"));
            return aggregationEngine.pivot(input, q.dimensions(rowDims), q.dimensions(req.getColumns()),
                    q.measures(), new PivotOptions(req.isIncludeTotals(), percentageOf));
        });
    }

    public ResultTable rollup(String dataset, RowSet rows, SubtotalRequest req) {
        return run("rollup", dataset, rows, req, (ds, input) -> {
            ResolvedQuery q = resolveSubtotals(ds, input, req);
            return percentOfTotal(req, aggregationEngine.rollup(input, q.dimensions(), q.measures()), q);
        });
    }

    public ResultTable cube(String dataset, RowSet rows, SubtotalRequest req) {
        return run("cube", dataset, rows, req, (ds, input) -> {
            ResolvedQuery q = resolveSubtotals(ds, input, req);
            return percentOfTotal(req, aggregationEngine.cube(input, q.dimensions(), q.measures()), q);
        });
    }

    public ResultTable groupingSets(String dataset, RowSet rows, GroupingSetsRequest req) {
        return run("grouping_sets", dataset, rows, req, (ds, input) -> {
            ResolvedQuery q = resolveSubtotals(ds, input, req);
            ResultTable grouped = aggregationEngine.groupingSets(input, q.dimensions(), req.getGroupingSets(),
                    q.measures());
            return percentOfTotal(req, grouped, q);
        });
    }

    public ResultTable timeSeries(String dataset, RowSet rows, TimeSeriesRequest req) {
        return run("time_series", dataset, rows, req, (ds, input) -> {
            TimeSeriesCall call = timeSeriesCall(ds, input, req);
            return timeSeriesEngine.timeSeries(input, call.timeField(), call.grain(), call.measures(),
                    call.options());
        });
    }

    /**
     * Count, min, max, sum, average, first, last and total change of each measure over the buckets of the series.
     */
    public ResultTable timeSeriesSummary(String dataset, RowSet rows, TimeSeriesRequest req) {
        return run("time_series_summary", dataset, rows, req, (ds, input) -> {
            TimeSeriesCall call = timeSeriesCall(ds, input, req);
            return timeSeriesEngine.summary(input, call.timeField(), call.grain(), call.measures(), call.options());
        });
    }

    private TimeSeriesCall timeSeriesCall(Dataset ds, RowSet input, TimeSeriesRequest req) {
        TimeGrain grain = TimeGrain.parse(req.getGrain()).orElseThrow(() -> new InvalidArgumentException(
                "Unknown time grain '" + req.getGrain() + "'"));
        String timeDim = timeDimension(ds, req.getTimeDimension(), grain);
        PeriodComparison comparison = req.getComparison() == null || req.getComparison().isBlank() ? null
                : PeriodComparison.parse(req.getComparison()).orElseThrow(() -> new InvalidArgumentException(
                "Unknown comparison '" + req.getComparison() + "'"));

        List<String> seriesBy = nullToEmpty(req.getSeriesBy());
        List<String> dims = new ArrayList<>();
        dims.add(timeDim);
        dims.addAll(seriesBy);
        ResolvedQuery q = resolver.resolve(ds, input.getColumns(), dims, req.getMeasures());
        TimeSeriesOptions options = new TimeSeriesOptions(lowerBound(req.getDateFrom()),
                upperBound(req.getDateTo()), req.isFillGaps(), comparison, q.dimensions(seriesBy), req.isTrend());
        return new TimeSeriesCall(q.dimension(timeDim), grain, q.measures(), options);
    }

    public ResultTable window(String dataset, RowSet rows, WindowRequest req) {
        return run("window", dataset, rows, req, (ds, input) -> {
            List<String> groupBy = nullToEmpty(req.getGroupBy());
            boolean grouped = !groupBy.isEmpty();
            ResultTable table;
            if (grouped) {
                ResolvedQuery q = resolver.resolve(ds, input.getColumns(), groupBy, nullToEmpty(req.getMeasures()));
                table = aggregationEngine.aggregate(input, q.dimensions(), q.measures());
            } else {
                table = ResultTable.of(input);
            }
            for (WindowCalculation calc : req.getCalculations()) {
                table = windowColumn(ds, input, table, grouped, calc);
            }
            return req.getLimit() == null ? table : table.head(req.getLimit());
        });
    }

    /**
     * Over raw input, semantic names resolve to their physical columns; over grouped rows, and for columns added
     * by earlier calculations, names are looked up in the current table.
     */
    private ResultTable windowColumn(Dataset ds, RowSet input, ResultTable table, boolean grouped,
                                     WindowCalculation calc) {
        WindowFunction function = WindowFunction.parse(calc.getFunction()).orElseThrow(
                () -> new InvalidArgumentException("Unknown window function '" + calc.getFunction() + "'"));
        Function<String, FieldRef> lookup = name -> {
            if (!grouped && (ds.dimension(name).isPresent() || ds.measure(name).isPresent())) {
                return resolver.resolveField(ds, input.getColumns(), name);
            }
            int i = table.requireIndex(name);
            return new FieldRef(name, i, table.getColumns().get(i).kind());
        };

        List<FieldRef> partitions = new ArrayList<>();
        for (String p : nullToEmpty(calc.getPartitionBy())) {
            partitions.add(lookup.apply(p));
        }
        List<SortKey> order = new ArrayList<>();
        for (WindowCalculation.OrderBy o : nullToEmpty(calc.getOrderBy())) {
            order.add(new SortKey(lookup.apply(o.getField()), o.isDescending()));
        }
        FieldRef value = calc.getValueField() == null ? null : lookup.apply(calc.getValueField());
        String name = calc.getOutputName() != null && !calc.getOutputName().isBlank() ? calc.getOutputName()
                : WindowEngine.defaultName(function, value);
        if (table.indexOf(name) >= 0) {
            throw new InvalidArgumentException("Window output '" + name + "' clashes with an existing column; "
                    + "set an output name");
        }
        WindowParams params = new WindowParams(calc.getSize(), calc.getOffset(), calc.getBuckets(),
                calc.getDefaultValue());
        return windowEngine.window(table, partitions, order, function, value, params, name);
    }

    public ResultTable summary(String dataset, RowSet rows, StatisticsRequest req) {
        return run("summary", dataset, rows, req, (ds, input) -> {
            ResolvedQuery q = resolver.resolve(ds, input.getColumns(), nullToEmpty(req.getGroupBy()),
                    req.getMeasures());
            return statisticsEngine.summary(input, q.dimensions(), q.measureColumns());
        });
    }

    public ResultTable percentiles(String dataset, RowSet rows, StatisticsRequest req) {
        return run("percentiles", dataset, rows, req, (ds, input) -> statisticsEngine.percentiles(input,
                measureColumns(ds, input, req.getMeasures()), req.getPercentiles()));
    }

    public ResultTable distribution(String dataset, RowSet rows, StatisticsRequest req) {
        return run("distribution", dataset, rows, req, (ds, input) ->
                statisticsEngine.distribution(input, measureColumns(ds, input, req.getMeasures())));
    }

    public ResultTable correlation(String dataset, RowSet rows, StatisticsRequest req) {
        return run("correlation", dataset, rows, req, (ds, input) ->
                statisticsEngine.correlation(input, measureColumns(ds, input, req.getMeasures())));
    }

    public ResultTable histogram(String dataset, RowSet rows, HistogramRequest req) {
        return run("histogram", dataset, rows, req, (ds, input) -> {
            FieldRef measure = measureColumns(ds, input, List.of(req.getMeasure())).get(0);
            return statisticsEngine.histogram(input, measure,
                    new HistogramSpec(req.getBinCount(), req.getBinWidth(), req.getMin(), req.getMax()));
        });
    }

    public ResultTable outliers(String dataset, RowSet rows, OutlierRequest req) {
        return run("outliers", dataset, rows, req, (ds, input) -> {
            OutlierMethod method = OutlierMethod.parse(req.getMethod()).orElseThrow(
                    () -> new InvalidArgumentException("Unknown outlier method '" + req.getMethod() + "'"));
            FieldRef measure = measureColumns(ds, input, List.of(req.getMeasure())).get(0);
            return statisticsEngine.outliers(input, measure, method, req.getThreshold());
        });
    }

    public ResultTable pareto(String dataset, RowSet rows, ParetoRequest req) {
        return run("pareto", dataset, rows, req, (ds, input) -> {
            ResolvedQuery q = resolver.resolve(ds, input.getColumns(), req.getGroupBy(), List.of(req.getMeasure()));
            RowSet grouped = aggregationEngine.aggregate(input, q.dimensions(), q.measures()).toRowSet();
            List<FieldRef> labels = new ArrayList<>();
            for (String g : req.getGroupBy()) {
                int i = grouped.requireIndex(g);
                labels.add(new FieldRef(g, i, grouped.column(i).kind()));
            }
            FieldRef measure = new FieldRef(req.getMeasure(), grouped.requireIndex(req.getMeasure()),
                    grouped.column(grouped.requireIndex(req.getMeasure())).kind());
            ParetoSpec spec = new ParetoSpec(req.getLimit(), req.isBottom(),
                    Optional.ofNullable(req.getClassAThreshold()).orElse(props.getPareto().getClassAThreshold()),
                    Optional.ofNullable(req.getClassBThreshold()).orElse(props.getPareto().getClassBThreshold()));
            return statisticsEngine.pareto(grouped, labels, measure, spec);
        });
    }

    private ResultTable run(String operation, String dataset, RowSet rows, AnalyticsRequest req,
                            BiFunction<Dataset, RowSet, ResultTable> body) {
        Objects.requireNonNull(rows, "rows");
        validate(req);
        StopWatch stopWatch = new StopWatch(operation);
        stopWatch.start();
        Dataset ds = registry.dataset(dataset);
        ResultTable result = body.apply(ds, applyConditions(ds, filter(ds, rows, req.getFilters()),
                req.getConditions()));
        stopWatch.stop();
        LOGGER.debug("{} on dataset {} over {} rows returned {} rows using {} ms", operation, dataset, rows.size(),
                result.size(), stopWatch.getTotalTimeMillis());
        return result;
    }

    private void validate(AnalyticsRequest req) {
        if (req == null) {
            throw new InvalidArgumentException("Request is required");
        }
        Set<ConstraintViolation<AnalyticsRequest>> violations = validator.validate(req);
        if (!violations.isEmpty()) {
            Set<String> messages = new TreeSet<>();
            for (ConstraintViolation<AnalyticsRequest> v : violations) {
                messages.add(v.getPropertyPath() + " " + v.getMessage());
            }
            throw new InvalidArgumentException("Invalid " + req.getClass().getSimpleName() + ": " + messages);
        }
    }

    private RowSet filter(Dataset ds, RowSet rows, Map<String, List<Object>> filters) {
        if (filters == null || filters.isEmpty()) {
            return rows;
        }
        RowSet filtered = rows;
        for (Map.Entry<String, List<Object>> f : filters.entrySet()) {
            if (f.getValue() == null) {
                throw new InvalidArgumentException("Filter on '" + f.getKey() + "' has no values");
            }
            FieldRef dim = resolver.resolve(ds, rows.getColumns(), List.of(f.getKey()), List.of())
                    .dimensions().get(0);
            List<Object> wanted = f.getValue();
            filtered = filtered.filter(row -> {
                Object cell = row.get(dim.index());
                for (Object w : wanted) {
                    if (CellValues.matches(cell, w)) {
                        return true;
                    }
                }
                return false;
            });
        }
        return filtered;
    }

    private RowSet applyConditions(Dataset ds, RowSet rows, List<FilterCondition> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return rows;
        }
        List<RowFilter> filters = new ArrayList<>(conditions.size());
        for (FilterCondition c : conditions) {
            FilterOperator operator = FilterOperator.parse(c.getOperator()).orElseThrow(
                    () -> new InvalidArgumentException("Unknown filter operator '" + c.getOperator() + "'"));
            FieldRef field = resolver.resolveField(ds, rows.getColumns(), c.getField());
            filters.add(RowFilter.of(field, operator, c.getValue()));
        }
        LOGGER.debug("Applying filter conditions {}", filters);
        return rows.filter(row -> {
            for (RowFilter f : filters) {
                if (!f.test(row)) {
                    return false;
                }
            }
            return true;
        });
    }

    private List<String> dimensions(Dataset ds, List<String> explicit, String hierarchy, String level) {
        boolean hasExplicit = explicit != null && !explicit.isEmpty();
        if (hierarchy == null || hierarchy.isBlank()) {
            if (level != null && !level.isBlank()) {
                throw new InvalidArgumentException("A hierarchy level needs a hierarchy");
            }
            return hasExplicit ? explicit : List.of();
        }
        if (hasExplicit) {
            throw new InvalidArgumentException("Specify either explicit dimensions or a hierarchy, not both");
        }
        return resolver.expandHierarchy(ds, hierarchy, level);
    }

    private ResolvedQuery resolveSubtotals(Dataset ds, RowSet input, SubtotalRequest req) {
        List<String> dims = dimensions(ds, req.getDimensions(), req.getHierarchy(), req.getHierarchyLevel());
        return resolver.resolve(ds, input.getColumns(), dims, req.getMeasures());
    }

    private ResultTable percentOfTotal(SubtotalRequest req, ResultTable grouped, ResolvedQuery q) {
        return req.isPercentOfTotal() ? aggregationEngine.withPercentOfTotal(grouped, q.measures()) : grouped;
    }

    private List<FieldRef> measureColumns(Dataset ds, RowSet input, List<String> measures) {
        return resolver.resolve(ds, input.getColumns(), List.of(), measures).measureColumns();
    }

    /**
     * The dimension to bucket by: the requested one or the dataset's time dimension. It must be temporal and must
     * support the grain.
     */
    private String timeDimension(Dataset ds, String requested, TimeGrain grain) {
        Optional<TimeDimension> declared = ds.getTimeDimension();
        String name = requested != null && !requested.isBlank() ? requested
                : declared.map(TimeDimension::dimension).orElseThrow(() -> new InvalidArgumentException(
                "Dataset '" + ds.getName() + "' declares no time dimension; name one explicitly"));
        Dimension dim = ds.dimension(name).orElseThrow(() -> new InvalidArgumentException(
                "Unknown time dimension '" + name + "' in dataset '" + ds.getName() + "'"));
        if (dim.kind() != DimensionKind.TEMPORAL) {
            throw new InvalidArgumentException("Dimension '" + name + "' is not temporal");
        }
        if (declared.isPresent() && declared.get().dimension().equals(name) && !declared.get().supports(grain)) {
            throw new InvalidArgumentException("Time dimension '" + name + "' does not support grain "
                    + grain.label() + "; supported: " + declared.get().grains());
        }
        if (dim.grain() != null && grain.ordinal() > dim.grain().ordinal()) {
            throw new InvalidArgumentException("Grain " + grain.label() + " is finer than the "
                    + dim.grain().label() + " grain of dimension '" + name + "'");
        }
        return name;
    }

    private static LocalDateTime lowerBound(String value) {
        return value == null || value.isBlank() ? null : parseBound(value);
    }

    /**
     * Date-only bounds cover their whole period: "2024-03" ends with the last instant of March.
     */
    private static LocalDateTime upperBound(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        LocalDateTime start = parseBound(value);
        return switch (value.trim().length()) {
            case 4 -> start.plusYears(1).minusNanos(1);
            case 7 -> start.plusMonths(1).minusNanos(1);
            case 10 -> start.plusDays(1).minusNanos(1);
            default -> start;
        };
    }

    private static LocalDateTime parseBound(String value) {
        try {
            return CellValues.toTimestamp(value);
        } catch (MalformedInputException e) {
            throw new InvalidArgumentException("Invalid date bound '" + value + "'", e);
        }
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private record TimeSeriesCall(FieldRef timeField, TimeGrain grain, List<MeasureRef> measures,
                                  TimeSeriesOptions options) {
    }
}
