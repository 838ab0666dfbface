package com.rollupquery.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum PredicateOperator {
    EQ("eq"),
    NEQ("neq"),
    LT("lt"),
    LTE("lte"),
    GT("gt"),
    GTE("gte"),
    BETWEEN("between"),
    IN("in");

    private final String code;

    PredicateOperator(String code) {
        this.code = code;
    }

    /**
     * Wire name used in descriptors and canonical keys.
     */
    public String getCode() {
        return code;
    }

    public static Optional<PredicateOperator> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(op -> op.code.equals(normalized))
                .findFirst();
    }
}
