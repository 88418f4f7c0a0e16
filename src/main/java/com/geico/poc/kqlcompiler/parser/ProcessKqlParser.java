package com.geico.poc.kqlcompiler.parser;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external parser executable once per query.
 *
 * The query is written to the process's stdin; its stdout is read by
 * {@link ParserOutputReader}. Its stderr is discarded. A non-zero exit code without an
 * error payload, or a timeout, is a parse failure. The timeout covers writing the query
 * as well as reading the tree.
 */
public class ProcessKqlParser implements KqlParser, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessKqlParser.class);

    public static final String PROCESS_ERROR = "Parser process failed";

    private final List<String> command;
    private final long timeoutMs;
    private final ParserOutputReader reader = new ParserOutputReader();
    private final ExecutorService io = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r);
        t.setName("kql-parser-io-" + t.getId());
        t.setDaemon(true);
        return t;
    });

    public ProcessKqlParser(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Parser command must not be empty");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("Parser timeout must be positive, got: " + timeoutMs);
        }
        this.command = new ArrayList<>(command);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public JsonNode parse(String kql) throws KqlParseException {
        log.debug("🔍 Parsing KQL with {}: {}", command.get(0), kql);

        Process process;
        try {
            process = new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.DISCARD).start();
        } catch (IOException e) {
            throw new KqlParseException(PROCESS_ERROR, "cannot start " + command.get(0) + ": " + e.getMessage(), e);
        }

        // both pipes are serviced off the calling thread so the timeout bounds the whole exchange
        Future<String> stdout = io.submit(() -> readAll(process.getInputStream()));
        Future<?> stdin = io.submit(() -> writeAll(process.getOutputStream(), kql));
        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new KqlParseException(PROCESS_ERROR, "timed out after " + timeoutMs + " ms");
            }
            String output = stdout.get(timeoutMs, TimeUnit.MILLISECONDS);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw exitFailure(exitCode, output);
            }
            stdin.get(timeoutMs, TimeUnit.MILLISECONDS);
            return reader.read(output);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new KqlParseException(PROCESS_ERROR, cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new KqlParseException(PROCESS_ERROR, "output not complete after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KqlParseException(PROCESS_ERROR, "interrupted", e);
        } finally {
            process.destroy();
            stdout.cancel(true);
            stdin.cancel(true);
        }
    }

    /**
     * Failure for a non-zero exit: the parser's own error payload when it printed one,
     * otherwise the exit code.
     */
    private KqlParseException exitFailure(int exitCode, String output) {
        try {
            reader.read(output);
        } catch (KqlParseException e) {
            if (!ParserOutputReader.OUTPUT_ERROR.equals(e.getTag())) {
                return e;
            }
            log.debug("Unreadable output from failed parser: {}", e.getDetail());
        }
        return new KqlParseException(PROCESS_ERROR, "exit code " + exitCode);
    }

    @Override
    public void close() {
        io.shutdownNow();
    }

    private static Void writeAll(OutputStream out, String kql) throws IOException {
        try (OutputStream stdin = out) {
            stdin.write(kql.getBytes(StandardCharsets.UTF_8));
        }
        return null;
    }

    private static String readAll(InputStream in) {
        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            byte[] chunk = new byte[8192];
            int n;
            while ((n = in.read(chunk)) != -1) {
                buffer.write(chunk, 0, n);
            }
            return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
