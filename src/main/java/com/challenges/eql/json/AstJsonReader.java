package com.challenges.eql.json;

import com.challenges.eql.ast.And;
import com.challenges.eql.ast.Comparison;
import com.challenges.eql.ast.Constant;
import com.challenges.eql.ast.Definition;
import com.challenges.eql.ast.EqlAnalytic;
import com.challenges.eql.ast.EqlNode;
import com.challenges.eql.ast.EventQuery;
import com.challenges.eql.ast.Expression;
import com.challenges.eql.ast.Field;
import com.challenges.eql.ast.FunctionCall;
import com.challenges.eql.ast.InSet;
import com.challenges.eql.ast.Join;
import com.challenges.eql.ast.Literal;
import com.challenges.eql.ast.Macro;
import com.challenges.eql.ast.MathOperation;
import com.challenges.eql.ast.NamedParams;
import com.challenges.eql.ast.NamedSubquery;
import com.challenges.eql.ast.Not;
import com.challenges.eql.ast.Or;
import com.challenges.eql.ast.PipeCommand;
import com.challenges.eql.ast.PipedQuery;
import com.challenges.eql.ast.Query;
import com.challenges.eql.ast.Sequence;
import com.challenges.eql.ast.SubqueryBy;
import com.challenges.eql.ast.TimeRange;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads syntax trees from their JSON form. Every node is an object tagged with {@code "type"}.
 */
public class AstJsonReader {
    static final String TYPE = "type";

    private final JsonFactory factory = new JsonFactory();

    public EqlNode read(InputStream input) throws IOException {
        return decode(readRaw(input));
    }

    public EqlNode read(String json) throws IOException {
        return decode(readRaw(json));
    }

    /**
     * Read a node that must be of the given kind.
     */
    public <T extends EqlNode> T read(String json, Class<T> type) throws IOException {
        return as(type, decode(readRaw(json)), "root");
    }

    /**
     * Read a JSON array of constants and macros.
     */
    public ImmutableList<Definition> readDefinitions(InputStream input) throws IOException {
        Object raw = readRaw(input);
        if (!(raw instanceof List<?> items)) {
            throw new IOException("Expected an array of definitions");
        }
        MutableList<Definition> definitions = Lists.mutable.empty();
        for (Object item : items) {
            EqlNode node = decode(item);
            if (!(node instanceof Definition definition)) {
                throw new IOException("Expected a definition but got " + node.getClass().getSimpleName());
            }
            definitions.add(definition);
        }
        return definitions.toImmutable();
    }

    Object readRaw(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return parseValue(parser, parser.nextToken());
        }
    }

    Object readRaw(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return parseValue(parser, parser.nextToken());
        }
    }

    private Object parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw new IOException("Unexpected end of input");
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

    private List<Object> parseArray(JsonParser parser) throws IOException {
        MutableList<Object> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return elements;
    }

    private EqlNode decode(Object raw) throws IOException {
        if (!(raw instanceof Map<?, ?> object)) {
            throw new IOException("Expected a node object but got " + describe(raw));
        }
        if (!(object.get(TYPE) instanceof String type)) {
            throw new IOException("Node is missing its \"" + TYPE + "\" tag");
        }

        switch (type) {
            case "String":
                return new Literal.StringLiteral(string(object, type, "value"));
            case "Number":
                return new Literal.NumberLiteral(number(object, type, "value"));
            case "Boolean":
                return Literal.BooleanLiteral.of(bool(object, type, "value"));
            case "Null":
                return new Literal.NullLiteral();
            case "TimeRange":
                return TimeRange.ofSeconds(number(object, type, "seconds").doubleValue());
            case "Field":
                return new Field(string(object, type, "base"), path(object, type));
            case "FunctionCall":
                return new FunctionCall(string(object, type, "name"), expressions(object, type, "arguments"),
                        object.get("as_method") instanceof Boolean asMethod && asMethod);
            case "NamedSubquery":
                try {
                    return new NamedSubquery(NamedSubquery.QueryType.fromKeyword(string(object, type, "query_type")),
                            node(object, type, "query", EventQuery.class));
                } catch (IllegalArgumentException e) {
                    throw new IOException(e.getMessage(), e);
                }
            case "MathOperation":
                try {
                    return new MathOperation(expression(object, type, "left"),
                            MathOperation.Operator.fromSymbol(string(object, type, "operator")),
                            expression(object, type, "right"));
                } catch (IllegalArgumentException e) {
                    throw new IOException(e.getMessage(), e);
                }
            case "Comparison":
                try {
                    return new Comparison(expression(object, type, "left"),
                            Comparison.Comparator.fromSymbol(string(object, type, "comparator")),
                            expression(object, type, "right"));
                } catch (IllegalArgumentException e) {
                    throw new IOException(e.getMessage(), e);
                }
            case "InSet":
                return new InSet(expression(object, type, "expression"), expressions(object, type, "container"));
            case "And":
                return new And(expressions(object, type, "terms"));
            case "Or":
                return new Or(expressions(object, type, "terms"));
            case "Not":
                return new Not(expression(object, type, "term"));
            case "EventQuery":
                return new EventQuery(string(object, type, "event_type"), expression(object, type, "query"));
            case "NamedParams":
                return params(object.get("kv"), type);
            case "SubqueryBy":
                return new SubqueryBy(node(object, type, "query", EventQuery.class),
                        object.get("params") == null ? null : node(object, type, "params", NamedParams.class),
                        expressions(object, type, "join_values"));
            case "Join":
                return new Join(nodes(object, type, "queries", SubqueryBy.class), optionalClose(object, type));
            case "Sequence":
                return new Sequence(nodes(object, type, "queries", SubqueryBy.class),
                        object.get("params") == null ? null : node(object, type, "params", NamedParams.class),
                        optionalClose(object, type));
            case "PipeCommand":
                return new PipeCommand(string(object, type, "name"), expressions(object, type, "arguments"));
            case "PipedQuery":
                return new PipedQuery(node(object, type, "first", Query.class),
                        nodes(object, type, "pipes", PipeCommand.class));
            case "EqlAnalytic":
                return new EqlAnalytic(node(object, type, "query", PipedQuery.class), metadata(object.get("metadata")));
            case "Constant":
                return new Constant(string(object, type, "name"), node(object, type, "value", Literal.class));
            case "Macro":
                return new Macro(string(object, type, "name"), strings(object, type, "parameters"),
                        expression(object, type, "expression"));
            default:
                throw new IOException("Unknown node type: " + type);
        }
    }

    private Expression expression(Map<?, ?> object, String type, String key) throws IOException {
        return node(object, type, key, Expression.class);
    }

    private ImmutableList<Expression> expressions(Map<?, ?> object, String type, String key) throws IOException {
        return nodes(object, type, key, Expression.class);
    }

    private <T extends EqlNode> T node(Map<?, ?> object, String type, String key, Class<T> kind) throws IOException {
        Object raw = object.get(key);
        if (raw == null) {
            throw new IOException("Missing attribute '" + key + "' for " + type);
        }
        return as(kind, decode(raw), type + "." + key);
    }

    private <T extends EqlNode> ImmutableList<T> nodes(Map<?, ?> object, String type, String key, Class<T> kind)
            throws IOException {
        Object raw = object.get(key);
        if (raw == null) {
            return Lists.immutable.empty();
        }
        if (!(raw instanceof List<?> items)) {
            throw new IOException("Expected an array for '" + key + "' in " + type + " but got " + describe(raw));
        }
        MutableList<T> result = Lists.mutable.empty();
        for (Object item : items) {
            result.add(as(kind, decode(item), type + "." + key));
        }
        return result.toImmutable();
    }

    private SubqueryBy optionalClose(Map<?, ?> object, String type) throws IOException {
        return object.get("close") == null ? null : node(object, type, "close", SubqueryBy.class);
    }

    private NamedParams params(Object raw, String type) throws IOException {
        if (raw == null) {
            return new NamedParams();
        }
        if (!(raw instanceof Map<?, ?> kv)) {
            throw new IOException("Expected an object for 'kv' in " + type + " but got " + describe(raw));
        }
        Map<String, Expression> values = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : kv.entrySet()) {
            values.put((String) entry.getKey(), as(Expression.class, decode(entry.getValue()), type + ".kv"));
        }
        return new NamedParams(values);
    }

    private ImmutableList<Object> path(Map<?, ?> object, String type) throws IOException {
        Object raw = object.get("path");
        if (raw == null) {
            return Lists.immutable.empty();
        }
        if (!(raw instanceof List<?> items)) {
            throw new IOException("Expected an array for 'path' in " + type + " but got " + describe(raw));
        }
        MutableList<Object> path = Lists.mutable.empty();
        for (Object item : items) {
            if (item instanceof String key) {
                path.add(key);
            } else if (item instanceof Long index) {
                path.add(index.intValue());
            } else {
                throw new IOException("Invalid path element for " + type + ": " + describe(item));
            }
        }
        return path.toImmutable();
    }

    private ImmutableList<String> strings(Map<?, ?> object, String type, String key) throws IOException {
        Object raw = object.get(key);
        if (!(raw instanceof List<?> items)) {
            throw new IOException("Expected an array for '" + key + "' in " + type + " but got " + describe(raw));
        }
        MutableList<String> result = Lists.mutable.empty();
        for (Object item : items) {
            if (!(item instanceof String text)) {
                throw new IOException("Expected a string in '" + key + "' for " + type + " but got " + describe(item));
            }
            result.add(text);
        }
        return result.toImmutable();
    }

    static Map<String, Object> metadata(Object raw) throws IOException {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map<?, ?> object)) {
            throw new IOException("Expected an object for metadata but got " + describe(raw));
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        object.forEach((key, value) -> metadata.put(String.valueOf(key), value));
        return metadata;
    }

    private static String string(Map<?, ?> object, String type, String key) throws IOException {
        if (!(object.get(key) instanceof String value)) {
            throw new IOException("Expected a string for '" + key + "' in " + type);
        }
        return value;
    }

    private static Number number(Map<?, ?> object, String type, String key) throws IOException {
        if (!(object.get(key) instanceof Number value)) {
            throw new IOException("Expected a number for '" + key + "' in " + type);
        }
        return value;
    }

    private static boolean bool(Map<?, ?> object, String type, String key) throws IOException {
        if (!(object.get(key) instanceof Boolean value)) {
            throw new IOException("Expected a boolean for '" + key + "' in " + type);
        }
        return value;
    }

    private static <T extends EqlNode> T as(Class<T> kind, EqlNode node, String slot) throws IOException {
        if (!kind.isInstance(node)) {
            throw new IOException("Expected " + kind.getSimpleName() + " for " + slot + " but got "
                    + node.getClass().getSimpleName());
        }
        return kind.cast(node);
    }

    private static String describe(Object raw) {
        return raw == null ? "null" : raw.getClass().getSimpleName();
    }
}
