package com.rollupquery.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Locale;
import java.util.Objects;

/**
 * One entry of a select list: a bare column or FUNCTION(column).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SelectItem {

    String column;

    /**
     * Upper-cased function name as written, null for a bare column.
     */
    String functionName;

    AggregateFunction function;

    public static SelectItem column(String column) {
        return new SelectItem(Objects.requireNonNull(column, "column"), null, null);
    }

    public static SelectItem aggregate(String functionName, String column) {
        Objects.requireNonNull(functionName, "functionName");
        Objects.requireNonNull(column, "column");
        String normalized = functionName.trim().toUpperCase(Locale.ROOT);
        return new SelectItem(column, normalized, AggregateFunction.fromName(normalized));
    }

    public boolean isAggregate() {
        return function != null;
    }

    /**
     * Output label, e.g. {@code SUM(bid_price)} or the bare column name.
     */
    public String getLabel() {
        return isAggregate() ? functionName + "(" + column + ")" : column;
    }
}
