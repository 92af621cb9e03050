package com.funcplan;

import com.funcplan.config.ConfigReader;
import com.funcplan.config.ToolConfig;
import com.funcplan.export.ExportFailedException;
import com.funcplan.export.GraphExporter;
import com.funcplan.export.HtmlGraphExporter;
import com.funcplan.export.SvgGraphExporter;
import com.funcplan.flatten.FlatGraph;
import com.funcplan.flatten.Flattener;
import com.funcplan.flatten.GraphChecks;
import com.funcplan.ir.PlanSerializer;
import com.funcplan.plan.FunctionPlan;
import com.funcplan.plan.PlanBuilder;
import com.funcplan.plan.PlanValidator;
import com.funcplan.plan.UnsupportedConstructException;
import com.funcplan.render.PseudocodeRenderer;
import com.funcplan.syntax.JdtSourceParser;
import com.funcplan.syntax.ParsedFunction;
import com.funcplan.syntax.ScoringFunctionSelector;
import com.funcplan.syntax.SourceAnalyzer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar funcplan-java.jar <source-file> [--func NAME] [--html] [--svg]
 *     [--out DIR] [--config FILE] [--strict-export]
 */
public class PlanMain {

    static final String USAGE = "Usage: funcplan <source-file> [--func NAME] [--html] [--svg] "
            + "[--out DIR] [--config FILE] [--strict-export]";
    static final String PSEUDO_FILE = "plan.pseudo";

    static final int EXIT_OK = 0;
    static final int EXIT_UNEXPECTED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_PARSE_ERROR = 3;
    static final int EXIT_FUNCTION_NOT_FOUND = 4;
    static final int EXIT_EXPORT_FAILED = 5;
    static final int EXIT_UNSUPPORTED = 6;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /** Runs the tool and maps every failure to its exit code. */
    static int execute(String[] args) {
        try {
            run(args);
            return EXIT_OK;
        } catch (UsageException e) {
            error("Usage", e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        } catch (ConfigReader.ConfigReadException e) {
            error("Config", e.getMessage());
            return EXIT_USAGE;
        } catch (JdtSourceParser.ParseException e) {
            error("ParseError", e.getMessage());
            return EXIT_PARSE_ERROR;
        } catch (SourceAnalyzer.FunctionNotFoundException e) {
            error("FunctionNotFound", e.getMessage());
            return EXIT_FUNCTION_NOT_FOUND;
        } catch (ExportFailedException e) {
            error("ExportFailed", e.getMessage());
            return EXIT_EXPORT_FAILED;
        } catch (UnsupportedConstructException e) {
            error("UnsupportedConstruct", e.getMessage());
            return EXIT_UNSUPPORTED;
        } catch (Exception e) {
            error("Unexpected", e.getClass().getSimpleName() + ": " + e.getMessage());
            return EXIT_UNEXPECTED;
        }
    }

    /** Parsed command line. */
    record Options(Path sourceFile, String functionName, boolean html, boolean svg,
                   Path outputDir, Path configFile, boolean strictExport) {}

    /** What one invocation produced. */
    record RunResult(FunctionPlan functionPlan, FlatGraph graph, Path outputDir,
                     List<Path> written, List<String> failedExports) {}

    static RunResult run(String[] args) {
        Options options = parseArgs(args);

        ToolConfig config = options.configFile() != null
                ? new ConfigReader().read(options.configFile())
                : ToolConfig.defaults();
        Path outputDir = options.outputDir() != null ? options.outputDir() : Paths.get(config.getOutputDir());

        if (!Files.isRegularFile(options.sourceFile())) {
            throw new UsageException("Source file not found: " + options.sourceFile());
        }

        // 1. Parse and select
        SourceAnalyzer analyzer = new SourceAnalyzer(
                config.getMaxSourceChars(), config.getLabelMaxLength(), new ScoringFunctionSelector());
        ParsedFunction parsed = analyzer.analyze(options.sourceFile(), options.functionName());

        // 2. Build and flatten
        FunctionPlan plan = new PlanBuilder(config.getUnsupportedPolicy())
                .build(parsed.function(), parsed.statements());
        new PlanValidator().requireValid(plan);
        FlatGraph graph = new Flattener().flatten(plan);
        GraphChecks.requireValid(graph);
        System.err.println("[funcplan] Plan built: " + plan.plan().preOrder().size() + " plan nodes, "
                + graph.nodes().size() + " graph nodes, " + graph.edges().size() + " edges, "
                + plan.warnings().size() + " warnings");

        // 3. Always-on outputs
        List<Path> written = new ArrayList<>();
        PlanSerializer serializer = new PlanSerializer();
        written.add(serializer.write(serializer.toDocument(parsed.sourceFile(), plan, graph), outputDir));
        written.add(writeFile(outputDir.resolve(PSEUDO_FILE),
                new PseudocodeRenderer().render(plan).getBytes(StandardCharsets.UTF_8)));

        // 4. Requested exports; a failure here never touches the files above
        List<GraphExporter> exporters = new ArrayList<>();
        if (options.html()) exporters.add(new HtmlGraphExporter());
        if (options.svg())  exporters.add(new SvgGraphExporter(config.getDotExecutable(), config.getExportTimeoutSeconds()));

        String title = config.getHtmlTitle() != null ? config.getHtmlTitle() : "funcplan: " + plan.signature();
        List<String> failed = new ArrayList<>();
        ExportFailedException firstFailure = null;
        for (GraphExporter exporter : exporters) {
            try {
                byte[] document = exporter.render(graph, title);
                written.add(writeExport(outputDir.resolve(exporter.fileName()), document));
            } catch (ExportFailedException e) {
                error("ExportFailed", exporter.format() + ": " + e.getMessage());
                failed.add(exporter.format());
                if (firstFailure == null) {
                    firstFailure = e;
                }
            }
        }
        if (firstFailure != null && options.strictExport()) {
            throw firstFailure;
        }

        System.err.println("[funcplan] Done.");
        return new RunResult(plan, graph, outputDir, written, failed);
    }

    static Options parseArgs(String[] args) {
        Path sourceFile = null;
        String functionName = null;
        boolean html = false;
        boolean svg = false;
        Path outputDir = null;
        Path configFile = null;
        boolean strictExport = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--func"   -> functionName = requireNext(args, i++, "--func");
                case "--html"   -> html = true;
                case "--svg"    -> svg = true;
                case "--out"    -> outputDir = Paths.get(requireNext(args, i++, "--out"));
                case "--config" -> configFile = Paths.get(requireNext(args, i++, "--config"));
                case "--strict-export" -> strictExport = true;
                default -> {
                    if (args[i].startsWith("--")) {
                        throw new UsageException("Unknown flag: " + args[i]);
                    }
                    if (sourceFile != null) {
                        throw new UsageException("Only one source file may be given, got " + sourceFile + " and " + args[i]);
                    }
                    sourceFile = Paths.get(args[i]);
                }
            }
        }

        if (sourceFile == null) throw new UsageException("No source file specified");
        return new Options(sourceFile, functionName, html, svg, outputDir, configFile, strictExport);
    }

    private static Path writeFile(Path path, byte[] content) {
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            Files.write(path, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
        System.err.println("[funcplan] " + path.getFileName() + " written: " + path);
        return path;
    }

    private static Path writeExport(Path path, byte[] content) {
        try {
            return writeFile(path, content);
        } catch (UncheckedIOException e) {
            throw new ExportFailedException(e.getMessage() + ": " + e.getCause().getMessage(), e.getCause());
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    private static void error(String kind, String message) {
        System.err.println("[funcplan] ERROR " + kind + ": " + message);
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
