package com.jcollect.query;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ValidatorMapTest {

    private static final Validator ALWAYS = (ref, operand) -> item -> true;

    @Test
    public void testNamesAreStoredWithDollarPrefix() {
        ValidatorMap validators = ValidatorMap.empty().with("past", ALWAYS).with("$future", ALWAYS);
        assertEquals(Set.of("$past", "$future"), validators.names());
        assertSame(ALWAYS, validators.get("$past"));
        assertNull(validators.get("past"));
    }

    @Test
    public void testWithReturnsCopy() {
        ValidatorMap empty = ValidatorMap.empty();
        ValidatorMap one = empty.with("x", ALWAYS);
        assertTrue(empty.isEmpty());
        assertEquals(1, one.size());
    }

    @Test
    public void testOfMap() {
        assertEquals(Set.of("$a", "$b"), ValidatorMap.of(Map.of("a", ALWAYS, "$b", ALWAYS)).names());
    }

    @ParameterizedTest
    @ValueSource(strings = {"$gt", "gte", "$in", "contains", "$includes", "not", "$eq"})
    public void testBuiltInNamesAreRejected(String name) {
        assertThrows(IllegalArgumentException.class, () -> ValidatorMap.empty().with(name, ALWAYS));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "$"})
    public void testBlankNamesAreRejected(String name) {
        assertThrows(IllegalArgumentException.class, () -> ValidatorMap.empty().with(name, ALWAYS));
    }

    @Test
    public void testNullValidatorIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ValidatorMap.empty().with("x", null));
    }
}
