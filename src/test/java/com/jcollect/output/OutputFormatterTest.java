package com.jcollect.output;

import com.jcollect.collection.ItemCollection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class OutputFormatterTest {

    record Point(int x, int y) {}

    private final OutputFormatter compact = new OutputFormatter(false);

    @ParameterizedTest
    @MethodSource("scalars")
    public void testScalars(Object value, String expected) {
        assertEquals(expected, compact.format(value));
    }

    static Stream<Arguments> scalars() {
        return Stream.of(
            Arguments.of(null, "null"),
            Arguments.of(true, "true"),
            Arguments.of(42L, "42"),
            Arguments.of(2.0, "2"),
            Arguments.of(2.5, "2.5"),
            Arguments.of(Double.NaN, "null"),
            Arguments.of("plain", "\"plain\""),
            Arguments.of("say \"hi\"\n", "\"say \\\"hi\\\"\\n\""),
            Arguments.of("\u0001", "\"\\u0001\"")
        );
    }

    @Test
    public void testCompactStructures() {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("b", Arrays.asList(1L, null));
        object.put("a", Map.of());
        assertEquals("{\"b\":[1,null],\"a\":{}}", compact.format(object));
        assertEquals("[]", compact.format(List.of()));
        assertEquals("[1,2]", compact.format(new int[] {1, 2}));
    }

    @Test
    public void testPrettyPrint() {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("id", 1L);
        object.put("tags", List.of("x"));
        assertEquals("{\n  \"id\": 1,\n  \"tags\": [\n    \"x\"\n  ]\n}", new OutputFormatter(true).format(object));
    }

    @Test
    public void testSortKeys() {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("b", 2L);
        object.put("a", 1L);
        assertEquals("{\"a\":1,\"b\":2}", new OutputFormatter(false, true).format(object));
        assertEquals("{\"b\":2,\"a\":1}", compact.format(object));
    }

    @Test
    public void testRecordsAndCollections() {
        assertEquals("{\"x\":1,\"y\":2}", compact.format(new Point(1, 2)));
        assertEquals("[1,2]", compact.format(ItemCollection.of(1, 2)));
    }

    @Test
    public void testUnknownObjectsUseToString() {
        Object custom = new Object() {
            @Override
            public String toString() {
                return "custom";
            }
        };
        assertEquals("\"custom\"", compact.format(custom));
    }
}
