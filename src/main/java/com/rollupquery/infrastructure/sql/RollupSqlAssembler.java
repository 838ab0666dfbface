package com.rollupquery.infrastructure.sql;

import com.rollupquery.domain.model.AggregateFunction;
import com.rollupquery.domain.model.DescriptorValue;
import com.rollupquery.domain.model.OrderByItem;
import com.rollupquery.domain.model.Predicate;
import com.rollupquery.domain.model.QueryDescriptor;
import com.rollupquery.domain.model.SelectItem;
import com.rollupquery.domain.parse.MalformedDescriptorException;
import com.rollupquery.domain.routing.RollupCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * SQL for either a rollup or the raw events source.
 *
 * Rollups store only cnt and per-measure sums, so aggregates are rewritten:
 * <pre>
 * COUNT(x)          -> SUM(cnt)
 * SUM(bid_price)    -> SUM(sum_bid)
 * AVG(bid_price)    -> SUM(sum_bid) * 1.0 / NULLIF(SUM(cnt), 0)
 * </pre>
 * Both forms alias every aggregate as "FUNC(col)" so output columns do not
 * depend on the source chosen.
 */
@Component
@RequiredArgsConstructor
public class RollupSqlAssembler implements SqlAssembler {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern AGGREGATE_LABEL = Pattern.compile("[A-Za-z_]+\\((\\*|[A-Za-z_][A-Za-z0-9_]*)\\)");

    private final RollupCatalog catalog;

    @Override
    public String assemble(QueryDescriptor descriptor, String source) {
        requireIdentifier(source, "source");
        boolean rollup = catalog.isRollup(source);
        if (!rollup && !catalog.isRawSource(source)) {
            throw new MalformedDescriptorException("Source is not in the rollup catalog: " + source);
        }

        List<String> parts = new ArrayList<>();
        parts.add("SELECT " + descriptor.getSelect().stream()
                .map(item -> selectExpression(item, rollup))
                .collect(Collectors.joining(", ")));
        parts.add("FROM " + source);

        if (!descriptor.getWhere().isEmpty()) {
            parts.add("WHERE " + descriptor.getWhere().stream()
                    .map(this::condition)
                    .collect(Collectors.joining(" AND ")));
        }
        if (!descriptor.getGroupBy().isEmpty()) {
            parts.add("GROUP BY " + descriptor.getGroupBy().stream()
                    .map(column -> requireIdentifier(column, "group_by"))
                    .collect(Collectors.joining(", ")));
        }
        if (!descriptor.getOrderBy().isEmpty()) {
            parts.add("ORDER BY " + descriptor.getOrderBy().stream()
                    .map(this::orderExpression)
                    .collect(Collectors.joining(", ")));
        }
        return String.join(" ", parts);
    }

    private String selectExpression(SelectItem item, boolean rollup) {
        if (!item.isAggregate()) {
            return requireIdentifier(item.getColumn(), "select");
        }
        String column = item.getColumn();
        if (!"*".equals(column)) {
            requireIdentifier(column, "select");
        }
        requireIdentifier(item.getFunctionName(), "select");

        String expression = rollup
                ? rollupAggregate(item)
                : item.getFunctionName() + "(" + column + ")";
        return expression + " AS " + quote(item.getLabel());
    }

    private String rollupAggregate(SelectItem item) {
        String count = "SUM(" + catalog.getCountColumn() + ")";
        String stored = catalog.getMeasureColumns().get(item.getColumn());
        AggregateFunction function = item.getFunction();

        if (function == AggregateFunction.COUNT) {
            return count;
        }
        if (stored != null && function == AggregateFunction.SUM) {
            return "SUM(" + stored + ")";
        }
        if (stored != null && function == AggregateFunction.AVG) {
            return "SUM(" + stored + ") * 1.0 / NULLIF(" + count + ", 0)";
        }
        // not routable to a rollup; only reachable through an explicit override
        return item.getFunctionName() + "(" + item.getColumn() + ")";
    }

    private String condition(Predicate predicate) {
        String column = requireIdentifier(predicate.getColumn(), "where");
        DescriptorValue value = predicate.getValue();

        switch (predicate.getOperator()) {
            case EQ:
                return isNull(value) ? column + " IS NULL" : column + " = " + literal(value);
            case NEQ:
                return isNull(value) ? column + " IS NOT NULL" : column + " != " + literal(value);
            case LT:
                return column + " < " + literal(value);
            case LTE:
                return column + " <= " + literal(value);
            case GT:
                return column + " > " + literal(value);
            case GTE:
                return column + " >= " + literal(value);
            case BETWEEN: {
                List<DescriptorValue> bounds = value.asList().getElements();
                return column + " BETWEEN " + literal(bounds.get(0)) + " AND " + literal(bounds.get(1));
            }
            case IN: {
                List<DescriptorValue> options = value.asList().getElements();
                if (options.isEmpty()) {
                    // IN () is not valid SQL; an empty set matches nothing
                    return "1 = 0";
                }
                return column + " IN (" + options.stream()
                        .map(this::literal)
                        .collect(Collectors.joining(", ")) + ")";
            }
            default:
                throw new MalformedDescriptorException("Unsupported operator: " + predicate.getOperator());
        }
    }

    private String orderExpression(OrderByItem item) {
        String column = item.getColumn();
        String direction = item.getDirection().name();
        if (IDENTIFIER.matcher(column).matches()) {
            return column + " " + direction;
        }
        if (AGGREGATE_LABEL.matcher(column).matches()) {
            return quote(normalizeLabel(column)) + " " + direction;
        }
        throw new MalformedDescriptorException("Cannot order by: " + column);
    }

    private String literal(DescriptorValue value) {
        if (!value.isScalar()) {
            throw new MalformedDescriptorException("Expected a single value, got " + value);
        }
        Object raw = value.asScalar().getValue();
        if (raw == null) {
            return "NULL";
        }
        if (raw instanceof Boolean) {
            return ((Boolean) raw) ? "TRUE" : "FALSE";
        }
        if (raw instanceof BigDecimal) {
            return ((BigDecimal) raw).toPlainString();
        }
        if (raw instanceof Number) {
            return raw.toString();
        }
        return "'" + raw.toString().replace("'", "''") + "'";
    }

    private static boolean isNull(DescriptorValue value) {
        return value.isScalar() && value.asScalar().isNull();
    }

    /**
     * Upper-cases the function part so "sum(bid_price)" matches the alias "SUM(bid_price)".
     */
    private static String normalizeLabel(String label) {
        int paren = label.indexOf('(');
        return label.substring(0, paren).toUpperCase(Locale.ROOT) + label.substring(paren);
    }

    private static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static String requireIdentifier(String name, String context) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new MalformedDescriptorException("Illegal identifier in " + context + ": " + name);
        }
        return name;
    }
}
