package com.jcollect.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads JSON into plain Java values: objects become insertion-ordered {@code Map<String, Object>},
 * arrays {@code List<Object>}, integers {@code Long}, decimals {@code Double}.
 */
public class JsonItemParser {
    private final JsonFactory factory = new JsonFactory();

    public Object parse(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseValue(parser, parser.nextToken());
        }
    }

    public Object parse(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return parseValue(parser, parser.nextToken());
        }
    }

    /**
     * Reads a top-level JSON array as a list of items. A single top-level value is read as a
     * one-item list.
     */
    @SuppressWarnings("unchecked")
    public List<Object> parseItems(InputStream input) throws IOException {
        Object root = parse(input);
        if (root instanceof List<?> list) {
            return (List<Object>) list;
        }
        return Lists.mutable.with(root);
    }

    private Object parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> parser.getText();
            case VALUE_NUMBER_INT -> parser.getLongValue();
            case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_NULL -> null;
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private Map<String, Object> parseObject(JsonParser parser) throws IOException {
        Map<String, Object> fields = new LinkedHashMap<>();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            fields.put(fieldName, parseValue(parser, parser.nextToken()));
        }

        return fields;
    }

    private MutableList<Object> parseArray(JsonParser parser) throws IOException {
        MutableList<Object> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return elements;
    }
}
