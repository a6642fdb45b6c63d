package io.blockchain.walletsync.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public final class SyncMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();

    private SyncMetrics() {}

    /** Times one block-listener call. */
    public static <T> T recordListenerCall(String phase, Supplier<T> call) {
        Timer timer = Timer.builder("wallet.sync.listener.time")
                .description("Duration of block listener calls")
                .tag("phase", phase)
                .register(registry);
        return timer.record(call);
    }

    public static void recordOutcome(String phase, String outcome) {
        outcomeCounter(phase, outcome).increment();
    }

    public static void recordOverrun(String phase) {
        overrunCounter(phase).increment();
    }

    public static double outcomeCount(String phase, String outcome) {
        return outcomeCounter(phase, outcome).count();
    }

    public static double overrunCount(String phase) {
        return overrunCounter(phase).count();
    }

    private static Counter outcomeCounter(String phase, String outcome) {
        return Counter.builder("wallet.sync.outcome")
                .description("Per-wallet results of block listener calls")
                .tag("phase", phase)
                .tag("outcome", outcome)
                .register(registry);
    }

    private static Counter overrunCounter(String phase) {
        return Counter.builder("wallet.sync.overruns")
                .description("Block listener calls that outlived the watchdog threshold")
                .tag("phase", phase)
                .register(registry);
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                for (Tag tag : m.getId().getTags()) {
                    sb.append(',').append(tag.getKey()).append('=').append(tag.getValue());
                }
                sb.append("} ")
                  .append(meas.getValue())
                  .append("\n");
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
