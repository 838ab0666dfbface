package com.rollupquery.domain.model;

import com.rollupquery.domain.parse.MalformedDescriptorException;
import lombok.Value;

import java.util.Objects;

/**
 * A single WHERE condition. Conditions of a descriptor are AND-ed in order.
 */
@Value
public class Predicate {

    String column;
    PredicateOperator operator;
    DescriptorValue value;

    public Predicate(String column, PredicateOperator operator, DescriptorValue value) {
        this.column = Objects.requireNonNull(column, "column");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = Objects.requireNonNull(value, "value");

        if (operator == PredicateOperator.BETWEEN
                && !(value.isList() && value.asList().size() == 2)) {
            throw new MalformedDescriptorException(
                    "'between' on column " + column + " needs a [low, high] pair");
        }
        if (operator == PredicateOperator.IN && !value.isList()) {
            throw new MalformedDescriptorException(
                    "'in' on column " + column + " needs a list of values");
        }
    }
}
