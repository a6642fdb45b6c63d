package io.blockchain.walletsync.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Settings of the wallet block listener. */
public final class WalletSyncConfig {
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** The watchdog warns after slotDuration / watchdogDivisor. */
    public final int watchdogDivisor;
    /** Keep warning (with doubling delays) while a call is still running. */
    public final boolean repeatWatchdogWarnings;
    /** JSON-lines file receiving failure reports, or null to discard them. */
    public final Path errorReportFile;
    /** File receiving secure log renderings, or null to drop them. */
    public final Path secureLogFile;

    public WalletSyncConfig(int watchdogDivisor, boolean repeatWatchdogWarnings, Path errorReportFile, Path secureLogFile) {
        if (watchdogDivisor <= 0) {
            throw new IllegalArgumentException("watchdogDivisor must be > 0");
        }
        this.watchdogDivisor = watchdogDivisor;
        this.repeatWatchdogWarnings = repeatWatchdogWarnings;
        this.errorReportFile = errorReportFile;
        this.secureLogFile = secureLogFile;
    }

    public static WalletSyncConfig defaults() {
        return new WalletSyncConfig(
                2,      // warn after half a slot
                true,
                null,
                null
        );
    }

    /** Read a JSON config file; a missing file yields {@link #defaults()}. */
    public static WalletSyncConfig load(Path path) {
        if (path == null || !Files.exists(path)) {
            return defaults();
        }
        try {
            JsonNode root = JSON.readTree(path.toFile());
            WalletSyncConfig d = defaults();
            return new WalletSyncConfig(
                    root.path("watchdogDivisor").asInt(d.watchdogDivisor),
                    root.path("repeatWatchdogWarnings").asBoolean(d.repeatWatchdogWarnings),
                    optionalPath(root, "errorReportFile", path),
                    optionalPath(root, "secureLogFile", path)
            );
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read wallet sync config from " + path, e);
        }
    }

    /** Relative paths resolve against the config file's directory. */
    private static Path optionalPath(JsonNode root, String field, Path configFile) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return null;
        }
        Path value = Path.of(node.asText());
        if (value.isAbsolute()) {
            return value;
        }
        Path base = configFile.toAbsolutePath().getParent();
        return base == null ? value : base.resolve(value).normalize();
    }

    @Override public String toString() {
        return "WalletSyncConfig{watchdogDivisor=" + watchdogDivisor
                + ", repeatWatchdogWarnings=" + repeatWatchdogWarnings
                + ", errorReportFile=" + errorReportFile
                + ", secureLogFile=" + secureLogFile + "}";
    }
}
