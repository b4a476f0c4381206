package com.jcomp.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.jcomp.value.Scope;
import com.jcomp.value.Value;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a JSON object of initial variables. Objects become maps keyed by strings, arrays
 * become lists, integral numbers ints and all other numbers floats.
 */
public class JsonBindingsReader {
    private final JsonFactory factory = new JsonFactory();

    public Scope read(InputStream input, Scope scope) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken first = parser.nextToken();
            if (first != JsonToken.START_OBJECT) {
                throw new IOException("Bindings must be a JSON object, found " + first);
            }
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                String name = parser.getCurrentName();
                scope.define(name, parseValue(parser, parser.nextToken()));
            }
        }
        return scope;
    }

    public Value readValue(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseValue(parser, parser.nextToken());
        }
    }

    private Value parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of JSON input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> Value.of(parser.getText());
            case VALUE_NUMBER_INT -> Value.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> Value.of(parser.getDoubleValue());
            case VALUE_TRUE -> Value.of(true);
            case VALUE_FALSE -> Value.of(false);
            case VALUE_NULL -> Value.unit();
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private Value parseObject(JsonParser parser) throws IOException {
        MutableMap<Value, Value> entries = Maps.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            entries.put(Value.of(fieldName), parseValue(parser, parser.nextToken()));
        }

        return new Value.MapValue(entries);
    }

    private Value parseArray(JsonParser parser) throws IOException {
        MutableList<Value> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return new Value.ListValue(elements);
    }
}
