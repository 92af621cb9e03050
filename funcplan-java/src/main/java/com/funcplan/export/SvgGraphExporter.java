package com.funcplan.export;

import com.funcplan.flatten.FlatGraph;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Renders the graph to SVG by piping DOT into the Graphviz {@code dot} executable.
 * The caller only gets bytes back once {@code dot} exited cleanly with SVG output.
 */
public class SvgGraphExporter implements GraphExporter {

    public static final String DEFAULT_DOT_EXECUTABLE = "dot";
    public static final long DEFAULT_TIMEOUT_SECONDS = 30;

    private final String dotExecutable;
    private final long timeoutSeconds;
    private final DotWriter dotWriter = new DotWriter();

    public SvgGraphExporter() {
        this(DEFAULT_DOT_EXECUTABLE, DEFAULT_TIMEOUT_SECONDS);
    }

    public SvgGraphExporter(String dotExecutable, long timeoutSeconds) {
        this.dotExecutable = dotExecutable;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String format() {
        return "svg";
    }

    @Override
    public byte[] render(FlatGraph graph, String title) {
        byte[] dot = dotWriter.write(graph, title).getBytes(StandardCharsets.UTF_8);
        List<String> command = List.of(dotExecutable, "-Tsvg");

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ExportFailedException("Graphviz '" + dotExecutable + "' executable not found. "
                    + "Install Graphviz or run without --svg.", e);
        }

        StreamFeeder stdin = new StreamFeeder(process.getOutputStream(), dot);
        StreamCollector stdout = new StreamCollector(process.getInputStream(), "stdout");
        StreamCollector stderr = new StreamCollector(process.getErrorStream(), "stderr");
        stdin.start();
        stdout.start();
        stderr.start();

        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ExportFailedException("Graphviz did not finish within " + timeoutSeconds + "s");
            }
            stdout.join();
            stderr.join();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExportFailedException("SVG export interrupted", e);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new ExportFailedException("Graphviz failed (exit " + exitCode + "): "
                    + stderr.text().trim());
        }
        byte[] svg = stdout.bytes();
        if (!new String(svg, StandardCharsets.UTF_8).contains("<svg")) {
            throw new ExportFailedException("Graphviz produced no SVG output");
        }
        return svg;
    }

    /** Writes the DOT input off the caller's thread, so a stalled child cannot outlast the timeout. */
    private static final class StreamFeeder extends Thread {
        private final OutputStream stream;
        private final byte[] content;

        StreamFeeder(OutputStream stream, byte[] content) {
            super("funcplan-dot-stdin");
            this.stream = stream;
            this.content = content;
            setDaemon(true);
        }

        @Override
        public void run() {
            try (OutputStream out = stream) {
                out.write(content);
            } catch (IOException e) {
                // dot closed its input early; its exit code and stderr say why
                System.err.println("[funcplan] Warning: could not write DOT input: " + e.getMessage());
            }
        }
    }

    /** Drains one process stream so the child never blocks on a full pipe. */
    private static final class StreamCollector extends Thread {
        private final InputStream stream;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        StreamCollector(InputStream stream, String name) {
            super("funcplan-dot-" + name);
            this.stream = stream;
            setDaemon(true);
        }

        @Override
        public void run() {
            try (InputStream in = stream) {
                in.transferTo(buffer);
            } catch (IOException e) {
                System.err.println("[funcplan] Warning: lost Graphviz " + getName() + ": " + e.getMessage());
            }
        }

        byte[] bytes() {
            return buffer.toByteArray();
        }

        String text() {
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }
}
