package com.jcollect.async;

import com.jcollect.collection.HaltException;
import com.jcollect.collection.Page;
import com.jcollect.query.Validator;
import com.jcollect.query.ValidatorMap;
import com.jcollect.path.PathResolver;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryExecutorTest {

    private static Map<String, Object> item(Object... keyValues) {
        Map<String, Object> item = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            item.put((String) keyValues[i], keyValues[i + 1]);
        }
        return item;
    }

    private static List<Map<String, Object>> accounts() {
        return List.of(
            item("id", 1L, "status", "active", "balance", 10L),
            item("id", 2L, "status", "inactive", "balance", 5L),
            item("id", 3L, "status", "active", "balance", 7L));
    }

    private static AsyncCollection<Map<String, Object>> collection() {
        return new AsyncCollection<>(new InMemoryExecutor<>(accounts()));
    }

    @Test
    public void testWhereResolvesToMatchingItems() {
        Object result = collection().where("status", "active").await();
        assertEquals(List.of(accounts().get(0), accounts().get(2)), result);
    }

    @Test
    public void testOperationsApplyInChainOrder() {
        Object result = collection().where("status", "active").sortBy("balance").first().await();
        assertEquals(3L, ((Map<?, ?>) result).get("id"));
    }

    @Test
    public void testScalarResults() {
        assertEquals(17.0, collection().where("status", "active").sum("balance").await());
        assertEquals(Map.of("active", 2, "inactive", 1), collection().countBy("status").await());
        assertEquals(10.0, collection().max("balance").await());
        assertEquals(true, collection().every("id").await());
    }

    @Test
    public void testCallbackKeysAndValues() {
        Map<?, ?> rich = (Map<?, ?>) collection().countBy((item, index) -> (Long) item.get("balance") > 6).await();
        assertEquals(Map.of("true", 2, "false", 1), rich);
        Map<?, ?> groups = (Map<?, ?>) collection().groupBy((item, index) -> item.get("status")).await();
        assertEquals(List.of("active", "inactive"), List.copyOf(groups.keySet()));
        assertEquals(44.0, collection().sum((item, index) -> (Long) item.get("balance") * 2).await());
        assertEquals(5.0, collection().min((item, index) -> item.get("balance")).await());
        assertEquals(22 / 3.0, (Double) collection().avg((item, index) -> item.get("balance")).await(), 1e-9);

        List<?> unique = (List<?>) collection().unique((item, index) -> item.get("status")).await();
        assertEquals(2, unique.size());
        Object richest = collection().sortByDesc((item, index) -> item.get("balance")).first().await();
        assertEquals(1L, ((Map<?, ?>) richest).get("id"));
    }

    @Test
    public void testEveryWithOperator() {
        assertEquals(true, collection().every("balance", ">", 4).await());
        assertEquals(false, collection().every("balance", ">", 6).await());
    }

    @Test
    public void testCollectReplacesItems() {
        AsyncCollection<Object> numbers = new AsyncCollection<>(new InMemoryExecutor<>(List.<Object>of(1L)));
        assertEquals(4.0, numbers.collect(List.of(2L, 4L, 6L)).avg().await());
        assertEquals(List.of(2L, 4L), numbers.collect(List.of(2L, 4L)).await());
    }

    @Test
    public void testPaginateDefaults() {
        Page<?> page = (Page<?>) collection().paginate().await();
        assertEquals(3, page.items().size());
        assertNull(page.prev());
        assertNull(page.next());
    }

    @Test
    public void testMutatingOperationsDoNotTouchSource() {
        List<Map<String, Object>> source = accounts();
        AsyncCollection<Map<String, Object>> chain = new AsyncCollection<>(new InMemoryExecutor<>(source))
            .delete(Map.of("status", "inactive"))
            .update(Map.of("flag", true));

        List<?> result = (List<?>) chain.await();
        assertEquals(2, result.size());
        assertEquals(true, ((Map<?, ?>) result.get(0)).get("flag"));
        assertEquals(3, source.size());
        assertFalse(source.get(0).containsKey("flag"));
    }

    @Test
    public void testValidatorsReachTheCollection() {
        Validator positive = (ref, operand) -> item ->
            ((Number) PathResolver.resolve(item, ref)).longValue() > 0 == (Boolean) operand;
        AsyncCollection<Map<String, Object>> chain = new AsyncCollection<>(
            new InMemoryExecutor<>(List.of(item("n", 1L), item("n", -1L))), ValidatorMap.empty().with("positive", positive));

        assertEquals(List.of(item("n", -1L)), chain.filter(Map.of("n", Map.of("$positive", false))).await());
    }

    @Test
    public void testOperationAfterScalarFails() {
        AsyncCollection<Map<String, Object>> chain = collection().sum("balance").reverse();
        IllegalStateException e = assertThrows(IllegalStateException.class, chain::await);
        assertTrue(e.getMessage().contains("reverse"));
    }

    @Test
    public void testDdRejectsTheChain() {
        assertThrows(HaltException.class, () -> collection().dd().await());
    }

    @Test
    public void testUnknownOperatorRejectsTheChain() {
        assertThrows(IllegalArgumentException.class,
            () -> collection().filter(Map.of("id", Map.of("$unknown", 1))).await());
    }

    @Test
    public void testEachSourceRunIsIndependent() {
        AsyncCollection<Map<String, Object>> base = collection();
        assertEquals(1, ((List<?>) base.where("id", 1).await()).size());
        assertEquals(3, ((List<?>) base.await()).size());
    }
}
