package io.blockchain.walletsync.reporting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Appends one JSON object per report to a file.
 */
public final class JsonLinesErrorReporter implements ErrorReporter {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Path file;

    public JsonLinesErrorReporter(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized void tryReport(FailureReport report) throws IOException {
        ObjectNode node = JSON.createObjectNode();
        node.put("time", report.time().toString());
        node.put("message", report.message());
        if (report.exceptionType() != null) {
            ObjectNode exception = node.putObject("exception");
            exception.put("type", report.exceptionType());
            exception.put("message", report.exceptionMessage());
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String line = JSON.writeValueAsString(node) + System.lineSeparator();
        Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
