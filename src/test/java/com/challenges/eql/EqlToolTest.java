package com.challenges.eql;

import com.challenges.eql.ast.And;
import com.challenges.eql.ast.Comparison;
import com.challenges.eql.ast.EqlAnalytic;
import com.challenges.eql.ast.EqlNode;
import com.challenges.eql.ast.EventQuery;
import com.challenges.eql.ast.Field;
import com.challenges.eql.ast.FunctionCall;
import com.challenges.eql.ast.Literal;
import com.challenges.eql.ast.Macro;
import com.challenges.eql.ast.PipeCommand;
import com.challenges.eql.ast.PipedQuery;
import com.challenges.eql.json.AstJsonReader;
import com.challenges.eql.json.AstJsonWriter;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EqlToolTest {

    @TempDir
    Path tempDir;

    private final AstJsonWriter writer = new AstJsonWriter();

    private StringWriter out;
    private StringWriter err;

    private int run(String stdin, String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine commandLine = new CommandLine(
                new EqlTool(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8))));
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private static Comparison eq(String field, long value) {
        return new Comparison(Field.of(field), Comparison.Comparator.EQ, new Literal.NumberLiteral(value));
    }

    @Test
    public void testRenderFromStdin() {
        EventQuery query = new EventQuery("process", eq("a", 1));

        int exitCode = run(writer.write(query));

        assertEquals(0, exitCode);
        assertEquals("process where a == 1", out.toString().strip());
    }

    @Test
    public void testRenderFromFile() throws IOException {
        Path input = tempDir.resolve("query.json");
        Files.writeString(input, writer.write(new EventQuery("network", Literal.BooleanLiteral.TRUE)));

        assertEquals(0, run("", input.toString()));
        assertEquals("network where true", out.toString().strip());
    }

    @Test
    public void testOptimize() {
        EventQuery query = new EventQuery("process", And.of(eq("a", 1), new Comparison(
                new Literal.NumberLiteral(1L), Comparison.Comparator.EQ, new Literal.NumberLiteral(1L)), eq("a", 2)));
        String json = writer.write(query);

        assertEquals(0, run(json));
        assertEquals("process where a == 1 and 1 == 1 and a == 2", out.toString().strip());

        assertEquals(0, run(json, "-O"));
        assertEquals("process where a == 1 and a == 2", out.toString().strip());
    }

    @Test
    public void testDefinitions() throws IOException {
        Path definitions = tempDir.resolve("definitions.json");
        Files.writeString(definitions, writer.writeDefinitions(List.of(
                new Macro("IsSystem", Lists.immutable.of("pid"), new Comparison(Field.of("pid"),
                        Comparison.Comparator.EQ, new Literal.NumberLiteral(4L))))));
        EventQuery query = new EventQuery("process", FunctionCall.of("IsSystem", Field.of("ppid")));

        assertEquals(0, run(writer.write(query), "--definitions", definitions.toString()));
        assertEquals("process where ppid == 4", out.toString().strip());
    }

    @Test
    public void testJsonOutput() throws IOException {
        EventQuery query = new EventQuery("process", new Comparison(new Literal.NumberLiteral(2L),
                Comparison.Comparator.LT, new Literal.NumberLiteral(1L)));

        assertEquals(0, run(writer.write(query), "-O", "-j"));
        EqlNode read = new AstJsonReader().read(out.toString());
        assertEquals(new EventQuery("process", Literal.BooleanLiteral.FALSE), read);
    }

    @Test
    public void testPersistedAnalytic() {
        EqlAnalytic analytic = new EqlAnalytic(new PipedQuery(new EventQuery("process", eq("a", 1)),
                Lists.immutable.of(PipeCommand.of("count"))), Map.of("id", "abc"));

        assertEquals(0, run(writer.write(analytic), "-p"));
        String persisted = out.toString();
        assertTrue(persisted.contains("\"id\" : \"abc\""), persisted);
        assertTrue(persisted.contains("\"query\" : \"process where a == 1\\n| count\""), persisted);
    }

    @Test
    public void testPersistedRequiresAnalytic() {
        assertEquals(1, run(writer.write(new EventQuery("process", eq("a", 1))), "-p"));
        assertEquals("Error: Only analytics have a persisted form", err.toString().strip());
    }

    @Test
    public void testUnknownPipe() {
        PipedQuery query = new PipedQuery(new EventQuery("process", eq("a", 1)),
                Lists.immutable.of(PipeCommand.of("window", new Literal.NumberLiteral(5L))));

        assertEquals(1, run(writer.write(query)));
        assertEquals("Error: Unknown pipe: window", err.toString().strip());
    }

    @Test
    public void testMalformedInput() {
        assertEquals(1, run("{\"type\": \"Between\"}"));
        assertEquals("Error: Unknown node type: Between", err.toString().strip());
    }

    @Test
    public void testMissingFile() {
        assertEquals(1, run("", tempDir.resolve("missing.json").toString()));
        assertTrue(err.toString().startsWith("Error: "));
    }
}
