package com.jcollect;

import com.jcollect.async.AsyncCollection;
import com.jcollect.async.InMemoryExecutor;
import com.jcollect.json.JsonItemParser;
import com.jcollect.output.OutputFormatter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Command(name = "jcollect", mixinStandardHelpOptions = true, version = "1.0",
         description = "Filter, sort and aggregate a JSON array of items")
public class JCollect implements Callable<Integer> {
    private static final Pattern CONDITION = Pattern.compile("^([^=!<>]+?)(>=|<=|!=|=|>|<)(.*)$");
    private static final Pattern JSON_SCALAR =
            Pattern.compile("^(-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?|\".*\")$");

    @Parameters(index = "0", arity = "0..1", description = "Input JSON file (default: stdin)")
    private File inputFile;

    @Option(names = {"-w", "--where"}, description = "Keep items matching key<op>value; ops: >= <= != = > <")
    private List<String> where = new ArrayList<>();

    @Option(names = "--where-not", description = "Drop items matching key<op>value")
    private List<String> whereNot = new ArrayList<>();

    @Option(names = "--sort", paramLabel = "key[:asc|desc]", description = "Sort by a key path")
    private String sort;

    @Option(names = "--unique", paramLabel = "key", description = "Keep the first item per key value")
    private String unique;

    @Option(names = "--group-by", paramLabel = "key", description = "Group items by a key path")
    private String groupBy;

    @Option(names = "--count-by", paramLabel = "key", description = "Count items per key value")
    private String countBy;

    @Option(names = "--sum", paramLabel = "key", description = "Sum the numeric values of a key path")
    private String sum;

    @Option(names = "--first", description = "Output only the first item")
    private boolean first = false;

    @Option(names = "--page", description = "Page number, starting at 1")
    private Integer page;

    @Option(names = "--per-page", description = "Items per page (default: ${DEFAULT-VALUE})")
    private int perPage = 20;

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort object keys in output")
    private boolean sortKeys = false;

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JCollect()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        try {
            JsonItemParser jsonParser = new JsonItemParser();
            List<Object> items;
            try (InputStream input = inputFile != null ? new FileInputStream(inputFile) : System.in) {
                items = jsonParser.parseItems(input);
            }

            AsyncCollection<Object> chain = buildChain(new AsyncCollection<>(new InMemoryExecutor<>(items)));
            Object result = chain.await();

            OutputFormatter formatter = new OutputFormatter(!compactOutput, sortKeys);
            spec.commandLine().getOut().println(formatter.format(result));
            spec.commandLine().getOut().flush();
            return 0;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }
    }

    AsyncCollection<Object> buildChain(AsyncCollection<Object> base) throws IOException {
        AsyncCollection<Object> chain = base;
        for (String condition : where) {
            Matcher m = condition(condition);
            chain = chain.where(m.group(1).trim(), m.group(2), literal(m.group(3).trim()));
        }
        for (String condition : whereNot) {
            Matcher m = condition(condition);
            chain = chain.whereNot(m.group(1).trim(), m.group(2), literal(m.group(3).trim()));
        }
        if (unique != null) {
            chain = chain.unique(unique);
        }
        if (sort != null) {
            int colon = sort.lastIndexOf(':');
            chain = colon < 0
                    ? chain.sort(sort)
                    : chain.sort(sort.substring(0, colon), sort.substring(colon + 1));
        }

        int terminals = (groupBy != null ? 1 : 0) + (countBy != null ? 1 : 0) + (sum != null ? 1 : 0)
                + (first ? 1 : 0) + (page != null ? 1 : 0);
        if (terminals > 1) {
            throw new IllegalArgumentException("Only one of --group-by, --count-by, --sum, --first, --page may be given");
        }
        if (groupBy != null) {
            return chain.groupBy(groupBy);
        }
        if (countBy != null) {
            return chain.countBy(countBy);
        }
        if (sum != null) {
            return chain.sum(sum);
        }
        if (first) {
            return chain.first();
        }
        if (page != null) {
            return chain.paginate(page, perPage);
        }
        return chain;
    }

    private static Matcher condition(String condition) {
        Matcher m = CONDITION.matcher(condition);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid condition '" + condition + "', expected key<op>value");
        }
        return m;
    }

    /** Reads a command-line value as a JSON scalar when it is one, else as a plain string. */
    static Object literal(String text) throws IOException {
        if (text.equals("true") || text.equals("false")) {
            return Boolean.valueOf(text);
        }
        if (text.equals("null")) {
            return null;
        }
        if (JSON_SCALAR.matcher(text).matches()) {
            return new JsonItemParser().parse(text);
        }
        return text;
    }
}
