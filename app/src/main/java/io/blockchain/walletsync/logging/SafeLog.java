package io.blockchain.walletsync.logging;

import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logger pair that keeps secrets out of public logs.
 *
 * Every message is a function of {@link SecurityLevel}. The PUBLIC rendering
 * goes to the named logger, the SECURE rendering to {@code secure.<name>}.
 * Secure loggers never propagate to the root handlers; attach a handler with
 * {@link #addSecureHandler(Handler)} to keep them.
 */
public final class SafeLog {
    public static final String SECURE_ROOT = "secure";
    public static final String HIDDEN = "<hidden>";

    private static final Logger SECURE_PARENT = Logger.getLogger(SECURE_ROOT);

    static {
        SECURE_PARENT.setUseParentHandlers(false);
    }

    private final Logger publicLog;
    private final Logger secureLog;

    private SafeLog(Logger publicLog, Logger secureLog) {
        this.publicLog = publicLog;
        this.secureLog = secureLog;
    }

    public static SafeLog named(String name) {
        Objects.requireNonNull(name, "name");
        return new SafeLog(Logger.getLogger(name), Logger.getLogger(SECURE_ROOT + "." + name));
    }

    /** Route every secure rendering to {@code handler}. */
    public static void addSecureHandler(Handler handler) {
        SECURE_PARENT.addHandler(handler);
    }

    public String name() {
        return publicLog.getName();
    }

    public Logger publicLogger() {
        return publicLog;
    }

    public Logger secureLogger() {
        return secureLog;
    }

    public void info(Function<SecurityLevel, String> message) {
        log(Level.INFO, message);
    }

    public void warning(Function<SecurityLevel, String> message) {
        log(Level.WARNING, message);
    }

    public void log(Level level, Function<SecurityLevel, String> message) {
        if (secureLog.isLoggable(level)) {
            secureLog.log(level, message.apply(SecurityLevel.SECURE));
        }
        if (publicLog.isLoggable(level)) {
            publicLog.log(level, message.apply(SecurityLevel.PUBLIC));
        }
    }

    /** Shows the value only on secure sinks. */
    public static String secretOnly(SecurityLevel level, Object value) {
        return level == SecurityLevel.SECURE ? String.valueOf(value) : HIDDEN;
    }

    public static String safe(SecurityLevel level, SafeFormattable value) {
        return value == null ? "null" : value.format(level);
    }
}
