package com.jcollect.output;

import com.jcollect.path.PathResolver;
import com.jcollect.query.Values;

import java.lang.reflect.Array;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders plain Java values as JSON text. Maps and records render as objects, iterables and arrays
 * as arrays, anything else unknown as its string form.
 */
public class OutputFormatter {
    private final boolean prettyPrint;
    private final boolean sortKeys;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public OutputFormatter(boolean prettyPrint) {
        this(prettyPrint, false);
    }

    public OutputFormatter(boolean prettyPrint, boolean sortKeys) {
        this.prettyPrint = prettyPrint;
        this.sortKeys = sortKeys;
    }

    public String format(Object value) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0);

        format(value, 0, sb);

        return sb.toString();
    }

    private void format(Object value, int indent, StringBuilder sb) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof CharSequence text) {
            sb.append('"').append(escapeString(text.toString())).append('"');
        } else if (value instanceof Number number) {
            formatNumber(number, sb);
        } else if (value instanceof Boolean bool) {
            sb.append(bool.booleanValue());
        } else if (value instanceof Map<?, ?> map) {
            formatObject(map, indent, sb);
        } else if (value instanceof Iterable<?> iterable) {
            List<Object> elements = new ArrayList<>();
            iterable.forEach(elements::add);
            formatArray(elements, indent, sb);
        } else if (value.getClass().isArray()) {
            List<Object> elements = new ArrayList<>();
            for (int i = 0; i < Array.getLength(value); i++) {
                elements.add(Array.get(value, i));
            }
            formatArray(elements, indent, sb);
        } else if (value.getClass().isRecord()) {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (RecordComponent component : value.getClass().getRecordComponents()) {
                fields.put(component.getName(), PathResolver.resolve(value, component.getName()));
            }
            formatObject(fields, indent, sb);
        } else {
            sb.append('"').append(escapeString(value.toString())).append('"');
        }
    }

    private void formatObject(Map<?, ?> map, int indent, StringBuilder sb) {
        if (map.isEmpty()) {
            sb.append("{}");
            return;
        }
        String indentStr = " ".repeat(indent);
        Map<?, ?> entries = sortKeys ? sorted(map) : map;

        sb.append('{');
        boolean first = true;
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;

            if (prettyPrint) {
                sb.append('\n').append(indentStr).append("  ");
            }
            sb.append('"')
              .append(escapeString(String.valueOf(entry.getKey())))
              .append(prettyPrint ? "\": " : "\":");
            format(entry.getValue(), indent + 2, sb);
        }
        if (prettyPrint) {
            sb.append('\n').append(indentStr);
        }
        sb.append('}');
    }

    private void formatArray(List<Object> elements, int indent, StringBuilder sb) {
        if (elements.isEmpty()) {
            sb.append("[]");
            return;
        }
        String indentStr = " ".repeat(indent);

        sb.append('[');
        boolean first = true;
        for (Object element : elements) {
            if (!first) {
                sb.append(',');
            }
            first = false;

            if (prettyPrint) {
                sb.append('\n').append(indentStr).append("  ");
            }
            format(element, indent + 2, sb);
        }
        if (prettyPrint) {
            sb.append('\n').append(indentStr);
        }
        sb.append(']');
    }

    private static void formatNumber(Number number, StringBuilder sb) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                sb.append("null");
                return;
            }
            sb.append(Values.keyOf(number));
            return;
        }
        sb.append(number);
    }

    private static Map<String, Object> sorted(Map<?, ?> map) {
        Map<String, Object> sorted = new TreeMap<>();
        map.forEach((key, value) -> sorted.put(String.valueOf(key), value));
        return sorted;
    }

    private String escapeString(String s) {
        // Fast path: if no escaping needed, return original
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default   -> {
                    if (c < 0x20) {
                        result.append(String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }
}
