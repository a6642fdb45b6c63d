package io.blockchain.walletsync.reporting;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesErrorReporterTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    void appendsOneObjectPerReport() throws Exception {
        Path file = dir.resolve("reports/failures.jsonl");
        JsonLinesErrorReporter reporter = new JsonLinesErrorReporter(file);

        reporter.tryReport(FailureReport.of("first", new IllegalStateException("boom")));
        reporter.tryReport(new FailureReport(Instant.parse("2026-03-01T10:00:00Z"), "second", null, null));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());

        JsonNode first = JSON.readTree(lines.get(0));
        assertEquals("first", first.get("message").asText());
        assertEquals(IllegalStateException.class.getName(), first.path("exception").path("type").asText());
        assertEquals("boom", first.path("exception").path("message").asText());

        JsonNode second = JSON.readTree(lines.get(1));
        assertEquals("2026-03-01T10:00:00Z", second.get("time").asText());
        assertFalse(second.has("exception"));
    }
}
