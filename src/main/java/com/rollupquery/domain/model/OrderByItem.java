package com.rollupquery.domain.model;

import lombok.Value;

import java.util.Locale;
import java.util.Objects;

@Value
public class OrderByItem {

    public enum Direction {
        ASC,
        DESC;

        public static Direction fromCode(String code) {
            if (code == null || code.isBlank()) {
                return ASC;
            }
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        }

        public String getCode() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    String column;
    Direction direction;

    public OrderByItem(String column, Direction direction) {
        this.column = Objects.requireNonNull(column, "column");
        this.direction = direction != null ? direction : Direction.ASC;
    }
}
