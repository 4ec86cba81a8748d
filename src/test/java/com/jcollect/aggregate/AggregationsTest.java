package com.jcollect.aggregate;

import com.jcollect.query.ItemPredicate;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class AggregationsTest {

    private static Map<String, Object> product(long id, String category, double price) {
        Map<String, Object> product = new LinkedHashMap<>();
        product.put("id", id);
        product.put("categoria", category);
        product.put("price", price);
        return product;
    }

    private static MutableList<Map<String, Object>> products() {
        return Lists.mutable.with(
            product(1, "perifericos", 20.0),
            product(2, "pantallas", 150.0),
            product(3, "perifericos", 35.5));
    }

    @Test
    public void testGroupByBucketsInFirstSeenOrder() {
        Map<String, MutableList<Map<String, Object>>> groups =
            Aggregations.groupBy(products(), Aggregations.key("categoria"));

        assertEquals(List.of("perifericos", "pantallas"), List.copyOf(groups.keySet()));
        assertEquals(2, groups.get("perifericos").size());
        assertEquals(1, groups.get("pantallas").size());
    }

    @Test
    public void testGroupByCoversEveryItemExactlyOnce() {
        MutableList<Map<String, Object>> items = products();
        Map<String, MutableList<Map<String, Object>>> groups = Aggregations.groupBy(items, Aggregations.key("categoria"));

        int total = 0;
        Set<Object> ids = new HashSet<>();
        for (MutableList<Map<String, Object>> bucket : groups.values()) {
            total += bucket.size();
            bucket.forEach(item -> ids.add(item.get("id")));
        }
        assertEquals(items.size(), total);
        assertEquals(Set.of(1L, 2L, 3L), ids);
    }

    @Test
    public void testGroupByCoercesKeysToStrings() {
        MutableList<Object> numbers = Lists.mutable.with(1L, 2.0, 2L, null, true);
        Map<String, Integer> counts = Aggregations.countBy(numbers, (item, index) -> item);

        assertEquals(Map.of("1", 1, "2", 2, "null", 1, "true", 1), counts);
    }

    @Test
    public void testCountBy() {
        Map<String, Integer> counts = Aggregations.countBy(products(), Aggregations.key("categoria"));
        assertEquals(2, counts.get("perifericos"));
        assertEquals(1, counts.get("pantallas"));
    }

    @Test
    public void testKeyByLastWriteWins() {
        Map<String, Map<String, Object>> byCategory = Aggregations.keyBy(products(), Aggregations.key("categoria"));
        assertEquals(2, byCategory.size());
        assertEquals(3L, byCategory.get("perifericos").get("id"));
    }

    @Test
    public void testPartitionIsComplete() {
        MutableList<Map<String, Object>> items = products();
        ItemPredicate<Map<String, Object>> cheap = (item, index) -> ((Double) item.get("price")) < 100;
        Pair<MutableList<Map<String, Object>>, MutableList<Map<String, Object>>> parts =
            Aggregations.partition(items, cheap);

        assertEquals(items.size(), parts.getOne().size() + parts.getTwo().size());
        assertEquals(List.of(1L, 3L), parts.getOne().collect(item -> item.get("id")));
        assertEquals(List.of(2L), parts.getTwo().collect(item -> item.get("id")));
    }

    @Test
    public void testUniqueKeepsFirstOccurrence() {
        MutableList<Map<String, Object>> unique = Aggregations.unique(products(), Aggregations.key("categoria"));
        assertEquals(List.of(1L, 2L), unique.collect(item -> item.get("id")));
    }

    @Test
    public void testUniqueTreatsEqualNumbersAsOne() {
        MutableList<Object> unique = Aggregations.unique(Lists.mutable.with(1, 1L, 1.0, 2), (item, index) -> item);
        assertEquals(List.of(1, 2), unique);
    }

    @Test
    public void testReduceIsLeftFoldWithIndex() {
        String folded = Aggregations.reduce(Lists.mutable.with("a", "b", "c"),
            (acc, item, index) -> acc + index + item, ">");
        assertEquals(">0a1b2c", folded);
    }

    @ParameterizedTest
    @MethodSource("numericFolds")
    public void testNumericFolds(List<Object> values, double sum, Double avg, Double min, Double max) {
        MutableList<Object> items = Lists.mutable.withAll(values);
        ItemFunction<Object, Object> self = (item, index) -> item;

        assertEquals(sum, Aggregations.sum(items, self), 1e-9);
        assertNumber(avg, Aggregations.avg(items, self));
        assertNumber(min, Aggregations.min(items, self));
        assertNumber(max, Aggregations.max(items, self));
    }

    private static void assertNumber(Double expected, Double actual) {
        if (expected == null) {
            assertNull(actual);
        } else {
            assertNotNull(actual);
            assertEquals(expected.doubleValue(), actual.doubleValue(), 1e-9);
        }
    }

    static Stream<Arguments> numericFolds() {
        return Stream.of(
            Arguments.of(List.of(), 0.0, null, null, null),
            Arguments.of(List.of(1L, 2L, 3L), 6.0, 2.0, 1.0, 3.0),
            Arguments.of(List.of(4, "x", 2.5), 6.5, 3.25, 2.5, 4.0),
            Arguments.of(List.of("a", "b"), 0.0, null, null, null)
        );
    }

    @Test
    public void testSumIsAdditiveOverConcatenation() {
        MutableList<Map<String, Object>> a = products();
        MutableList<Map<String, Object>> b = Lists.mutable.with(product(4, "x", 5.0), product(5, "y", 7.25));
        ItemFunction<Map<String, Object>, Object> price = Aggregations.key("price");

        double combined = Aggregations.sum(Lists.mutable.withAll(a).withAll(b), price);
        assertEquals(Aggregations.sum(a, price) + Aggregations.sum(b, price), combined, 1e-9);
    }
}
