package com.challenges.eql.json;

import com.challenges.eql.ast.And;
import com.challenges.eql.ast.Comparison;
import com.challenges.eql.ast.Constant;
import com.challenges.eql.ast.Definition;
import com.challenges.eql.ast.EqlAnalytic;
import com.challenges.eql.ast.EqlNode;
import com.challenges.eql.ast.EventQuery;
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
import com.challenges.eql.ast.Sequence;
import com.challenges.eql.ast.SubqueryBy;
import com.challenges.eql.ast.TimeRange;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Writes syntax trees in the JSON form read by {@link AstJsonReader}.
 */
public class AstJsonWriter {
    private final JsonFactory factory = new JsonFactory();
    private final boolean prettyPrint;

    public AstJsonWriter() {
        this(false);
    }

    public AstJsonWriter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String write(EqlNode node) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = configure(factory.createGenerator(out))) {
            writeNode(generator, node);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    public void write(EqlNode node, OutputStream output) throws IOException {
        try (JsonGenerator generator = configure(factory.createGenerator(output))) {
            writeNode(generator, node);
        }
    }

    /**
     * Write constants and macros as a JSON array. Custom macros have no JSON form.
     */
    public String writeDefinitions(Iterable<? extends Definition> definitions) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = configure(factory.createGenerator(out))) {
            generator.writeStartArray();
            for (Definition definition : definitions) {
                if (!(definition instanceof EqlNode node)) {
                    throw new IllegalArgumentException("Unable to write definition " + definition.name());
                }
                writeNode(generator, node);
            }
            generator.writeEndArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    private JsonGenerator configure(JsonGenerator generator) {
        return prettyPrint ? generator.useDefaultPrettyPrinter() : generator;
    }

    private void writeNode(JsonGenerator gen, EqlNode node) throws IOException {
        gen.writeStartObject();
        gen.writeStringField(AstJsonReader.TYPE, typeName(node));

        if (node instanceof Literal.StringLiteral string) {
            gen.writeStringField("value", string.value());
        } else if (node instanceof Literal.NumberLiteral number) {
            gen.writeFieldName("value");
            writeNumber(gen, number.value());
        } else if (node instanceof Literal.BooleanLiteral bool) {
            gen.writeBooleanField("value", bool.value());
        } else if (node instanceof TimeRange range) {
            gen.writeNumberField("seconds", range.totalSeconds());
        } else if (node instanceof Field field) {
            gen.writeStringField("base", field.base());
            gen.writeArrayFieldStart("path");
            for (Object key : field.path()) {
                if (key instanceof Integer index) {
                    gen.writeNumber(index);
                } else {
                    gen.writeString((String) key);
                }
            }
            gen.writeEndArray();
        } else if (node instanceof FunctionCall call) {
            gen.writeStringField("name", call.name());
            writeNodes(gen, "arguments", call.arguments());
            gen.writeBooleanField("as_method", call.asMethod());
        } else if (node instanceof NamedSubquery subquery) {
            gen.writeStringField("query_type", subquery.queryType().keyword());
            writeChild(gen, "query", subquery.query());
        } else if (node instanceof MathOperation math) {
            writeChild(gen, "left", math.left());
            gen.writeStringField("operator", math.operator().symbol());
            writeChild(gen, "right", math.right());
        } else if (node instanceof Comparison comparison) {
            writeChild(gen, "left", comparison.left());
            gen.writeStringField("comparator", comparison.comparator().symbol());
            writeChild(gen, "right", comparison.right());
        } else if (node instanceof InSet set) {
            writeChild(gen, "expression", set.expression());
            writeNodes(gen, "container", set.container());
        } else if (node instanceof And and) {
            writeNodes(gen, "terms", and.terms());
        } else if (node instanceof Or or) {
            writeNodes(gen, "terms", or.terms());
        } else if (node instanceof Not not) {
            writeChild(gen, "term", not.term());
        } else if (node instanceof EventQuery query) {
            gen.writeStringField("event_type", query.eventType());
            writeChild(gen, "query", query.query());
        } else if (node instanceof NamedParams params) {
            gen.writeObjectFieldStart("kv");
            for (Map.Entry<String, ? extends EqlNode> entry : params.kv().entrySet()) {
                writeChild(gen, entry.getKey(), entry.getValue());
            }
            gen.writeEndObject();
        } else if (node instanceof SubqueryBy subquery) {
            writeChild(gen, "query", subquery.query());
            writeChild(gen, "params", subquery.params());
            writeNodes(gen, "join_values", subquery.joinValues());
        } else if (node instanceof Join join) {
            writeNodes(gen, "queries", join.queries());
            writeOptional(gen, "close", join.close());
        } else if (node instanceof Sequence sequence) {
            writeNodes(gen, "queries", sequence.queries());
            writeChild(gen, "params", sequence.params());
            writeOptional(gen, "close", sequence.close());
        } else if (node instanceof PipeCommand pipe) {
            gen.writeStringField("name", pipe.name());
            writeNodes(gen, "arguments", pipe.arguments());
        } else if (node instanceof PipedQuery piped) {
            writeChild(gen, "first", piped.first());
            writeNodes(gen, "pipes", piped.pipes());
        } else if (node instanceof EqlAnalytic analytic) {
            writeChild(gen, "query", analytic.query());
            gen.writeFieldName("metadata");
            writeValue(gen, analytic.metadata());
        } else if (node instanceof Constant constant) {
            gen.writeStringField("name", constant.name());
            writeChild(gen, "value", constant.value());
        } else if (node instanceof Macro macro) {
            gen.writeStringField("name", macro.name());
            gen.writeArrayFieldStart("parameters");
            for (String parameter : macro.parameters()) {
                gen.writeString(parameter);
            }
            gen.writeEndArray();
            writeChild(gen, "expression", macro.expression());
        }

        gen.writeEndObject();
    }

    private void writeChild(JsonGenerator gen, String name, EqlNode child) throws IOException {
        gen.writeFieldName(name);
        writeNode(gen, child);
    }

    private void writeOptional(JsonGenerator gen, String name, EqlNode child) throws IOException {
        if (child != null) {
            writeChild(gen, name, child);
        }
    }

    private void writeNodes(JsonGenerator gen, String name, Iterable<? extends EqlNode> children) throws IOException {
        gen.writeArrayFieldStart(name);
        for (EqlNode child : children) {
            writeNode(gen, child);
        }
        gen.writeEndArray();
    }

    private static String typeName(EqlNode node) {
        if (node instanceof Literal.StringLiteral) {
            return "String";
        } else if (node instanceof Literal.NumberLiteral) {
            return "Number";
        } else if (node instanceof Literal.BooleanLiteral) {
            return "Boolean";
        } else if (node instanceof Literal.NullLiteral) {
            return "Null";
        }
        return node.getClass().getSimpleName();
    }

    private static void writeNumber(JsonGenerator gen, Number number) throws IOException {
        if (number instanceof Long || number instanceof Integer) {
            gen.writeNumber(number.longValue());
        } else {
            gen.writeNumber(number.doubleValue());
        }
    }

    /**
     * Write a plain value: maps, iterables, strings, numbers, booleans and null.
     */
    static void writeValue(JsonGenerator gen, Object value) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof String text) {
            gen.writeString(text);
        } else if (value instanceof Number number) {
            writeNumber(gen, number);
        } else if (value instanceof Boolean bool) {
            gen.writeBoolean(bool);
        } else if (value instanceof Map<?, ?> map) {
            gen.writeStartObject();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                gen.writeFieldName(String.valueOf(entry.getKey()));
                writeValue(gen, entry.getValue());
            }
            gen.writeEndObject();
        } else if (value instanceof Iterable<?> items) {
            gen.writeStartArray();
            for (Object item : items) {
                writeValue(gen, item);
            }
            gen.writeEndArray();
        } else {
            throw new IllegalArgumentException("Unable to write " + value.getClass().getSimpleName() + " as JSON");
        }
    }
}
