package com.challenges.eql.json;

import com.challenges.eql.ast.EqlAnalytic;
import com.challenges.eql.ast.PipedQuery;
import com.challenges.eql.render.Renderer;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.function.Function;

/**
 * Persisted form of an analytic: {@code {"metadata": {...}, "query": "<source text>"}}.
 * <p>
 * The query is stored as rendered source text, so reading it back needs a parser for that text.
 */
public class AnalyticCodec {
    private final JsonFactory factory = new JsonFactory();
    private final AstJsonReader reader = new AstJsonReader();
    private final Renderer renderer;
    private final boolean prettyPrint;

    public AnalyticCodec(Renderer renderer) {
        this(renderer, false);
    }

    public AnalyticCodec(Renderer renderer, boolean prettyPrint) {
        this.renderer = renderer;
        this.prettyPrint = prettyPrint;
    }

    public String write(EqlAnalytic analytic) {
        StringWriter out = new StringWriter();
        try (JsonGenerator gen = factory.createGenerator(out)) {
            if (prettyPrint) {
                gen.useDefaultPrettyPrinter();
            }
            gen.writeStartObject();
            gen.writeFieldName("metadata");
            AstJsonWriter.writeValue(gen, analytic.metadata());
            gen.writeStringField("query", renderer.render(analytic.query()));
            gen.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    /**
     * Read a persisted analytic.
     *
     * @param queryParser turns the stored source text back into a query
     */
    public EqlAnalytic read(String json, Function<String, PipedQuery> queryParser) throws IOException {
        Object raw = reader.readRaw(json);
        if (!(raw instanceof Map<?, ?> object)) {
            throw new IOException("Expected an analytic object");
        }
        if (!(object.get("query") instanceof String text)) {
            throw new IOException("Analytic is missing its query text");
        }
        return new EqlAnalytic(queryParser.apply(text), AstJsonReader.metadata(object.get("metadata")));
    }
}
