package com.rollupquery.domain.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rollupquery.domain.model.DescriptorValue;
import com.rollupquery.domain.model.OrderByItem;
import com.rollupquery.domain.model.Predicate;
import com.rollupquery.domain.model.QueryDescriptor;
import com.rollupquery.domain.model.SelectItem;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the canonical cache key of a query descriptor.
 *
 * Normalization:
 * - object keys sorted lexicographically at every nesting level
 * - array elements kept in input order (conjunction order is part of identity)
 * - compact JSON, no whitespace
 *
 * The whole canonical string is used as the key, not a digest of it, so two
 * different descriptors can never share a key. The router's decision cache
 * and the result cache both key on this string.
 *
 * Stateless and safe for concurrent use.
 */
public final class CanonicalKeyBuilder {

    public static final String SELECT = "select";
    public static final String GROUP_BY = "group_by";
    public static final String WHERE = "where";
    public static final String ORDER_BY = "order_by";
    public static final String FROM = "from";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private CanonicalKeyBuilder() {
    }

    public static String canonicalize(QueryDescriptor descriptor) {
        return canonicalize(toValue(descriptor));
    }

    public static String canonicalize(DescriptorValue value) {
        try {
            return MAPPER.writeValueAsString(toJson(value));
        } catch (JsonProcessingException e) {
            // a tree of plain nodes always serializes
            throw new IllegalStateException("Unable to serialize descriptor value", e);
        }
    }

    /**
     * Maps a descriptor onto its structural form, the same shape the
     * descriptor has on the wire.
     */
    public static DescriptorValue toValue(QueryDescriptor descriptor) {
        Map<String, DescriptorValue> root = new LinkedHashMap<>();

        List<DescriptorValue> select = new ArrayList<>();
        for (SelectItem item : descriptor.getSelect()) {
            select.add(item.isAggregate()
                    ? DescriptorValue.map(Map.of(item.getFunctionName(), DescriptorValue.text(item.getColumn())))
                    : DescriptorValue.text(item.getColumn()));
        }
        root.put(SELECT, DescriptorValue.list(select));

        root.put(GROUP_BY, DescriptorValue.list(
                descriptor.getGroupBy().stream().map(DescriptorValue::text).toList()));

        List<DescriptorValue> where = new ArrayList<>();
        for (Predicate predicate : descriptor.getWhere()) {
            where.add(DescriptorValue.map(Map.of(
                    "col", DescriptorValue.text(predicate.getColumn()),
                    "op", DescriptorValue.text(predicate.getOperator().getCode()),
                    "val", predicate.getValue())));
        }
        root.put(WHERE, DescriptorValue.list(where));

        List<DescriptorValue> orderBy = new ArrayList<>();
        for (OrderByItem item : descriptor.getOrderBy()) {
            orderBy.add(DescriptorValue.map(Map.of(
                    "col", DescriptorValue.text(item.getColumn()),
                    "dir", DescriptorValue.text(item.getDirection().getCode()))));
        }
        root.put(ORDER_BY, DescriptorValue.list(orderBy));

        if (descriptor.hasSourceOverride()) {
            root.put(FROM, DescriptorValue.text(descriptor.getSource()));
        }
        return DescriptorValue.map(root);
    }

    private static JsonNode toJson(DescriptorValue value) {
        switch (value.getKind()) {
            case LIST: {
                ArrayNode array = NODES.arrayNode();
                for (DescriptorValue element : value.asList().getElements()) {
                    array.add(toJson(element));
                }
                return array;
            }
            case MAP: {
                ObjectNode object = NODES.objectNode();
                // MapValue iterates in sorted key order
                value.asMap().getEntries().forEach((k, v) -> object.set(k, toJson(v)));
                return object;
            }
            default:
                return scalarToJson(value.asScalar());
        }
    }

    private static JsonNode scalarToJson(DescriptorValue.Scalar scalar) {
        Object raw = scalar.getValue();
        if (raw == null) {
            return NODES.nullNode();
        }
        if (raw instanceof String) {
            return NODES.textNode((String) raw);
        }
        if (raw instanceof Boolean) {
            return NODES.booleanNode((Boolean) raw);
        }
        if (raw instanceof Long) {
            return NODES.numberNode((Long) raw);
        }
        if (raw instanceof Double) {
            return NODES.numberNode((Double) raw);
        }
        if (raw instanceof BigDecimal) {
            return NODES.numberNode((BigDecimal) raw);
        }
        if (raw instanceof BigInteger) {
            return NODES.numberNode((BigInteger) raw);
        }
        // remaining Number types
        return NODES.numberNode(new BigDecimal(raw.toString()));
    }
}
