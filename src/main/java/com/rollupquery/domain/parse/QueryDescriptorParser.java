package com.rollupquery.domain.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rollupquery.domain.model.DescriptorValue;
import com.rollupquery.domain.model.OrderByItem;
import com.rollupquery.domain.model.Predicate;
import com.rollupquery.domain.model.PredicateOperator;
import com.rollupquery.domain.model.QueryDescriptor;
import com.rollupquery.domain.model.SelectItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.rollupquery.domain.key.CanonicalKeyBuilder.FROM;
import static com.rollupquery.domain.key.CanonicalKeyBuilder.GROUP_BY;
import static com.rollupquery.domain.key.CanonicalKeyBuilder.ORDER_BY;
import static com.rollupquery.domain.key.CanonicalKeyBuilder.SELECT;
import static com.rollupquery.domain.key.CanonicalKeyBuilder.WHERE;

/**
 * Reads query descriptors from their JSON form.
 *
 * Expected shape:
 * <pre>
 * {
 *   "select":   ["country", {"SUM": "bid_price"}],
 *   "group_by": ["country"],
 *   "where":    [{"col": "type", "op": "eq", "val": "impression"}],
 *   "order_by": [{"col": "SUM(bid_price)", "dir": "desc"}],
 *   "from":     "events_parquet"
 * }
 * </pre>
 * Only "select" is required.
 */
@Component
@RequiredArgsConstructor
public class QueryDescriptorParser {

    private final ObjectMapper objectMapper;

    public QueryDescriptor parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new MalformedDescriptorException("Query descriptor is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public List<QueryDescriptor> parseAll(JsonNode array) {
        if (array == null || !array.isArray()) {
            throw new MalformedDescriptorException("Expected a JSON array of query descriptors");
        }
        List<QueryDescriptor> descriptors = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            descriptors.add(parse(node));
        }
        return descriptors;
    }

    public QueryDescriptor parse(JsonNode node) {
        if (node == null || !node.isObject() || node.isEmpty()) {
            throw new MalformedDescriptorException("Query descriptor must be a non-empty JSON object");
        }

        QueryDescriptor.QueryDescriptorBuilder builder = QueryDescriptor.builder();

        JsonNode select = node.get(SELECT);
        if (select == null || !select.isArray() || select.isEmpty()) {
            throw new MalformedDescriptorException("Query descriptor needs a non-empty '" + SELECT + "' array");
        }
        for (JsonNode item : select) {
            builder.selectItem(parseSelectItem(item));
        }

        for (JsonNode column : optionalArray(node, GROUP_BY)) {
            builder.groupByColumn(requireText(column, GROUP_BY));
        }

        for (JsonNode condition : optionalArray(node, WHERE)) {
            builder.predicate(parsePredicate(condition));
        }

        for (JsonNode order : optionalArray(node, ORDER_BY)) {
            builder.orderByItem(parseOrderBy(order));
        }

        JsonNode from = node.get(FROM);
        if (from != null && !from.isNull()) {
            builder.source(requireText(from, FROM));
        }
        return builder.build();
    }

    /**
     * Converts any JSON value into the closed descriptor value model.
     */
    public static DescriptorValue toDescriptorValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return DescriptorValue.nullValue();
        }
        if (node.isArray()) {
            List<DescriptorValue> elements = new ArrayList<>(node.size());
            node.forEach(element -> elements.add(toDescriptorValue(element)));
            return DescriptorValue.list(elements);
        }
        if (node.isObject()) {
            Map<String, DescriptorValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), toDescriptorValue(field.getValue()));
            }
            return DescriptorValue.map(entries);
        }
        if (node.isNumber()) {
            return DescriptorValue.number(node.numberValue());
        }
        if (node.isBoolean()) {
            return DescriptorValue.bool(node.booleanValue());
        }
        return DescriptorValue.text(node.asText());
    }

    private SelectItem parseSelectItem(JsonNode item) {
        if (item.isTextual()) {
            return SelectItem.column(item.textValue());
        }
        if (item.isObject() && item.size() == 1) {
            Map.Entry<String, JsonNode> entry = item.fields().next();
            return SelectItem.aggregate(entry.getKey(), requireText(entry.getValue(), SELECT));
        }
        throw new MalformedDescriptorException(
                "Select item must be a column name or a single {FUNCTION: column} entry, got " + item);
    }

    private Predicate parsePredicate(JsonNode condition) {
        if (!condition.isObject()) {
            throw new MalformedDescriptorException("Where condition must be an object, got " + condition);
        }
        String column = requireText(condition.get("col"), WHERE + ".col");
        String opCode = requireText(condition.get("op"), WHERE + ".op");
        PredicateOperator operator = PredicateOperator.fromCode(opCode)
                .orElseThrow(() -> new MalformedDescriptorException("Unknown where operator: " + opCode));
        if (!condition.has("val")) {
            throw new MalformedDescriptorException("Where condition on " + column + " has no 'val'");
        }
        return new Predicate(column, operator, toDescriptorValue(condition.get("val")));
    }

    private OrderByItem parseOrderBy(JsonNode order) {
        if (order.isTextual()) {
            return new OrderByItem(order.textValue(), OrderByItem.Direction.ASC);
        }
        if (!order.isObject()) {
            throw new MalformedDescriptorException("Order item must be an object, got " + order);
        }
        String column = requireText(order.get("col"), ORDER_BY + ".col");
        JsonNode dir = order.get("dir");
        try {
            return new OrderByItem(column, OrderByItem.Direction.fromCode(dir == null ? null : dir.asText()));
        } catch (IllegalArgumentException e) {
            throw new MalformedDescriptorException("Unknown sort direction: " + dir, e);
        }
    }

    private static Iterable<JsonNode> optionalArray(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new MalformedDescriptorException("'" + field + "' must be an array");
        }
        return value;
    }

    private static String requireText(JsonNode node, String field) {
        if (node == null || !node.isTextual() || node.textValue().isBlank()) {
            throw new MalformedDescriptorException("'" + field + "' must be a non-empty string");
        }
        return node.textValue();
    }
}
