package com.rollupquery.domain.key;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rollupquery.domain.model.DescriptorValue;
import com.rollupquery.domain.model.QueryDescriptor;
import com.rollupquery.domain.parse.QueryDescriptorParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalKeyBuilderTest {

    private QueryDescriptorParser parser;

    @BeforeEach
    void setUp() {
        parser = new QueryDescriptorParser(new ObjectMapper());
    }

    @Test
    void testCanonicalize_IgnoresObjectKeyOrder() {
        // Given
        QueryDescriptor first = parser.parse("{\"select\":[{\"COUNT\":\"*\"}],\"group_by\":[\"country\"],"
                + "\"where\":[{\"col\":\"type\",\"op\":\"eq\",\"val\":\"impression\"}]}");
        QueryDescriptor second = parser.parse("{\"where\":[{\"val\":\"impression\",\"op\":\"eq\",\"col\":\"type\"}],"
                + "\"group_by\":[\"country\"],\"select\":[{\"COUNT\":\"*\"}]}");

        // When / Then
        assertEquals(CanonicalKeyBuilder.canonicalize(first), CanonicalKeyBuilder.canonicalize(second));
    }

    @Test
    void testCanonicalize_SortsKeysAtEveryLevel() {
        // Given
        Map<String, DescriptorValue> inner = new LinkedHashMap<>();
        inner.put("z", DescriptorValue.number(1));
        inner.put("a", DescriptorValue.number(2));
        Map<String, DescriptorValue> outer = new LinkedHashMap<>();
        outer.put("y", DescriptorValue.map(inner));
        outer.put("b", DescriptorValue.text("x"));

        // When
        String key = CanonicalKeyBuilder.canonicalize(DescriptorValue.map(outer));

        // Then
        assertEquals("{\"b\":\"x\",\"y\":{\"a\":2,\"z\":1}}", key);
    }

    @Test
    void testCanonicalize_PreservesArrayOrder() {
        // Given
        QueryDescriptor countryFirst = parser.parse(
                "{\"select\":[\"country\",\"day\",{\"COUNT\":\"*\"}],\"group_by\":[\"country\",\"day\"]}");
        QueryDescriptor dayFirst = parser.parse(
                "{\"select\":[\"country\",\"day\",{\"COUNT\":\"*\"}],\"group_by\":[\"day\",\"country\"]}");

        // When / Then
        assertNotEquals(CanonicalKeyBuilder.canonicalize(countryFirst), CanonicalKeyBuilder.canonicalize(dayFirst));
    }

    @Test
    void testCanonicalize_DistinguishesNumberFromText() {
        // Given
        QueryDescriptor number = parser.parse(
                "{\"select\":[{\"COUNT\":\"*\"}],\"where\":[{\"col\":\"publisher_id\",\"op\":\"eq\",\"val\":42}]}");
        QueryDescriptor text = parser.parse(
                "{\"select\":[{\"COUNT\":\"*\"}],\"where\":[{\"col\":\"publisher_id\",\"op\":\"eq\",\"val\":\"42\"}]}");

        // When / Then
        assertNotEquals(CanonicalKeyBuilder.canonicalize(number), CanonicalKeyBuilder.canonicalize(text));
    }

    @Test
    void testCanonicalize_SourceOverrideIsPartOfKey() {
        // Given
        QueryDescriptor routed = parser.parse("{\"select\":[{\"COUNT\":\"*\"}],\"group_by\":[\"country\"]}");
        QueryDescriptor forced = routed.withSource("events_parquet");

        // When
        String routedKey = CanonicalKeyBuilder.canonicalize(routed);
        String forcedKey = CanonicalKeyBuilder.canonicalize(forced);

        // Then
        assertNotEquals(routedKey, forcedKey);
        assertFalse(routedKey.contains("\"from\""));
        assertTrue(forcedKey.contains("\"from\":\"events_parquet\""));
    }

    @Test
    void testCanonicalize_IsCompact() {
        // Given
        QueryDescriptor descriptor = parser.parse(
                "{ \"select\" : [ { \"SUM\" : \"bid_price\" } ] , \"group_by\" : [ \"country\" ] }");

        // When
        String key = CanonicalKeyBuilder.canonicalize(descriptor);

        // Then
        assertEquals("{\"group_by\":[\"country\"],\"order_by\":[],\"select\":[{\"SUM\":\"bid_price\"}],\"where\":[]}", key);
    }

    @Test
    void testCanonicalize_IntegerWidthDoesNotMatter() {
        // Given
        DescriptorValue small = DescriptorValue.list(List.of(DescriptorValue.number(7)));
        DescriptorValue wide = DescriptorValue.list(List.of(DescriptorValue.number(7L)));

        // When / Then
        assertEquals(CanonicalKeyBuilder.canonicalize(small), CanonicalKeyBuilder.canonicalize(wide));
    }
}
