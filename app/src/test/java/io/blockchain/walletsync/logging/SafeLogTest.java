package io.blockchain.walletsync.logging;

import io.blockchain.walletsync.testing.CapturingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.blockchain.walletsync.logging.SafeLog.secretOnly;
import static org.junit.jupiter.api.Assertions.*;

class SafeLogTest {
    private final SafeLog log = SafeLog.named("safelog.test");
    private CapturingHandler publicSink;
    private CapturingHandler secureSink;

    @BeforeEach
    void setUp() {
        publicSink = CapturingHandler.attach(log.publicLogger());
        secureSink = CapturingHandler.attach(Logger.getLogger(SafeLog.SECURE_ROOT));
    }

    @AfterEach
    void tearDown() {
        publicSink.detach();
        secureSink.detach();
    }

    @Test
    void secretsReachOnlyTheSecureSink() {
        log.warning(sl -> "wallet " + secretOnly(sl, "w-42") + " failed");

        assertEquals(List.of("wallet <hidden> failed"), publicSink.messages(Level.WARNING));
        assertEquals(List.of("wallet w-42 failed"), secureSink.messages(Level.WARNING));
    }

    @Test
    void secureLoggerIsOutsidePublicHierarchy() {
        assertEquals("secure.safelog.test", log.secureLogger().getName());
        assertFalse(log.secureLogger().getName().startsWith(log.name()));
    }

    @Test
    void safeFormattableRendersPerLevel() {
        SafeFormattable value = sl -> sl == SecurityLevel.SECURE ? "balance=10" : "balance=?";
        log.info(sl -> "state " + SafeLog.safe(sl, value));

        assertTrue(publicSink.anyContains("balance=?"));
        assertFalse(publicSink.anyContains("balance=10"));
        assertTrue(secureSink.anyContains("balance=10"));
    }
}
