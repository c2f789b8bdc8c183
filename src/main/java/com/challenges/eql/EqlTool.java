package com.challenges.eql;

import com.challenges.eql.ast.Definition;
import com.challenges.eql.ast.EqlAnalytic;
import com.challenges.eql.ast.EqlNode;
import com.challenges.eql.ast.PipeCommand;
import com.challenges.eql.functions.FunctionRegistry;
import com.challenges.eql.json.AnalyticCodec;
import com.challenges.eql.json.AstJsonReader;
import com.challenges.eql.json.AstJsonWriter;
import com.challenges.eql.optimizer.Optimizer;
import com.challenges.eql.pipes.PipeRegistry;
import com.challenges.eql.preprocessor.PreProcessor;
import com.challenges.eql.render.Renderer;
import com.challenges.eql.walk.Walker;
import org.eclipse.collections.api.list.ImmutableList;
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
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "eql-ast", mixinStandardHelpOptions = true, version = "1.0",
         description = "Expand, optimize and render event query syntax trees read as JSON")
public class EqlTool implements Callable<Integer> {
    @Parameters(index = "0", arity = "0..1", description = "Input JSON syntax tree (default: stdin)")
    private File inputFile;

    @Option(names = {"-O", "--optimize"}, description = "Optimize the tree before output")
    private boolean optimize = false;

    @Option(names = {"-j", "--json"}, description = "Output the JSON syntax tree instead of source text")
    private boolean jsonOutput = false;

    @Option(names = {"-p", "--persisted"}, description = "Output an analytic in its persisted JSON form")
    private boolean persisted = false;

    @Option(names = {"-d", "--definitions"}, description = "JSON array of constants and macros to expand")
    private File definitionsFile;

    @Option(names = {"-v", "--verbose"}, description = "Log diagnostic messages")
    private boolean verbose = false;

    @Spec
    private CommandSpec spec;

    private final InputStream stdin;

    public EqlTool() {
        this(System.in);
    }

    EqlTool(InputStream stdin) {
        this.stdin = stdin;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new EqlTool()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (verbose) {
            // read by slf4j-simple when the first logger is created
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }

        try {
            FunctionRegistry functions = FunctionRegistry.builtins();
            Optimizer optimizer = new Optimizer(functions);
            AstJsonReader reader = new AstJsonReader();

            EqlNode node;
            try (InputStream input = inputFile != null ? new FileInputStream(inputFile) : stdin) {
                node = reader.read(input);
            }
            checkPipes(node, PipeRegistry.builtins());

            if (definitionsFile != null) {
                ImmutableList<Definition> definitions;
                try (InputStream input = new FileInputStream(definitionsFile)) {
                    definitions = reader.readDefinitions(input);
                }
                node = new PreProcessor(optimizer, definitions).expand(node);
            }

            if (optimize) {
                node = optimizer.optimizeNode(node);
            }

            Renderer renderer = new Renderer(functions);
            if (persisted) {
                if (!(node instanceof EqlAnalytic analytic)) {
                    throw new IllegalArgumentException("Only analytics have a persisted form");
                }
                out.println(new AnalyticCodec(renderer, true).write(analytic));
            } else if (jsonOutput) {
                out.println(new AstJsonWriter(true).write(node));
            } else {
                out.println(renderer.render(node));
            }
            out.flush();
            return 0;
        } catch (IOException | RuntimeException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private static void checkPipes(EqlNode node, PipeRegistry pipes) {
        new Walker().iterate(node)
                .filter(PipeCommand.class::isInstance)
                .map(PipeCommand.class::cast)
                .forEach(pipes::require);
    }
}
