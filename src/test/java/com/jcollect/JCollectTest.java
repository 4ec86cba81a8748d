package com.jcollect;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class JCollectTest {

    private static final String ACCOUNTS = "["
        + "{\"id\":1,\"status\":\"active\",\"age\":17,\"team\":\"red\"},"
        + "{\"id\":2,\"status\":\"inactive\",\"age\":20,\"team\":\"blue\"},"
        + "{\"id\":3,\"status\":\"active\",\"age\":30,\"team\":\"red\"}"
        + "]";

    @TempDir
    Path tempDir;

    private Path input;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    public void setUp() throws IOException {
        input = tempDir.resolve("accounts.json");
        Files.writeString(input, ACCOUNTS, StandardCharsets.UTF_8);
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new JCollect());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        String[] withInput = new String[args.length + 1];
        System.arraycopy(args, 0, withInput, 0, args.length);
        withInput[args.length] = input.toString();
        return cmd.execute(withInput);
    }

    private String output() {
        return out.toString().trim();
    }

    @Test
    public void testWhereFiltersItems() {
        assertEquals(0, run("-c", "--where", "status=active"));
        assertEquals("[{\"id\":1,\"status\":\"active\",\"age\":17,\"team\":\"red\"},"
            + "{\"id\":3,\"status\":\"active\",\"age\":30,\"team\":\"red\"}]", output());
    }

    @ParameterizedTest
    @CsvSource({
        "age>=18, '[2,3]'",
        "age<18, '[1]'",
        "status!=active, '[2]'",
        "age>100, '[]'",
        "id=2, '[2]'"
    })
    public void testConditionOperators(String condition, String expectedIds) {
        assertEquals(0, run("-c", "-w", condition, "--sort", "id"));
        StringBuilder ids = new StringBuilder("[");
        for (String part : output().split("\"id\":")) {
            if (Character.isDigit(part.isEmpty() ? ' ' : part.charAt(0))) {
                ids.append(ids.length() > 1 ? "," : "").append(part.charAt(0));
            }
        }
        assertEquals(expectedIds, ids.append(']').toString());
    }

    @Test
    public void testRepeatedWhereIsAndCombined() {
        assertEquals(0, run("-c", "-w", "status=active", "-w", "age>18", "--sum", "age"));
        assertEquals("30", output());
    }

    @Test
    public void testWhereNot() {
        assertEquals(0, run("-c", "--where-not", "team=red", "--first"));
        assertEquals("{\"id\":2,\"status\":\"inactive\",\"age\":20,\"team\":\"blue\"}", output());
    }

    @Test
    public void testSortDescendingAndFirst() {
        assertEquals(0, run("-c", "--sort", "age:desc", "--first"));
        assertTrue(output().startsWith("{\"id\":3,"));
    }

    @Test
    public void testCountBy() {
        assertEquals(0, run("-c", "--count-by", "team"));
        assertEquals("{\"red\":2,\"blue\":1}", output());
    }

    @Test
    public void testGroupByWithSortedKeys() {
        assertEquals(0, run("-c", "-S", "--group-by", "team", "-w", "age>18"));
        assertEquals("{\"blue\":[{\"age\":20,\"id\":2,\"status\":\"inactive\",\"team\":\"blue\"}],"
            + "\"red\":[{\"age\":30,\"id\":3,\"status\":\"active\",\"team\":\"red\"}]}", output());
    }

    @Test
    public void testUnique() {
        assertEquals(0, run("-c", "--unique", "team", "--count-by", "team"));
        assertEquals("{\"red\":1,\"blue\":1}", output());
    }

    @Test
    public void testPage() {
        assertEquals(0, run("-c", "--page", "2", "--per-page", "2", "--sort", "id"));
        assertEquals("{\"items\":[{\"id\":3,\"status\":\"active\",\"age\":30,\"team\":\"red\"}],\"prev\":1,\"next\":null}",
            output());
    }

    @Test
    public void testPrettyOutputByDefault() {
        assertEquals(0, run("--count-by", "status"));
        assertEquals("{\n  \"active\": 2,\n  \"inactive\": 1\n}", output());
    }

    @Test
    public void testInvalidConditionReportsError() {
        assertEquals(1, run("-w", "status"));
        assertTrue(err.toString().startsWith("Error: Invalid condition 'status'"));
        assertEquals("", output());
    }

    @Test
    public void testConflictingTerminalsReportError() {
        assertEquals(1, run("--first", "--sum", "age"));
        assertTrue(err.toString().startsWith("Error: Only one of"));
    }

    @Test
    public void testMissingFileReportsError() throws IOException {
        Files.delete(input);
        assertEquals(1, run("--first"));
        assertTrue(err.toString().startsWith("Error: "));
    }

    @Test
    public void testLiteralParsing() throws IOException {
        assertEquals(5L, JCollect.literal("5"));
        assertEquals(-2.5, JCollect.literal("-2.5"));
        assertEquals(true, JCollect.literal("true"));
        assertNull(JCollect.literal("null"));
        assertEquals("a b", JCollect.literal("\"a b\""));
        assertEquals("active", JCollect.literal("active"));
        assertEquals("12abc", JCollect.literal("12abc"));
    }
}
