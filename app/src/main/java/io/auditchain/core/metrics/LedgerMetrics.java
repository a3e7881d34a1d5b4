package io.auditchain.core.metrics;

import io.auditchain.core.event.EventKind;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksMined = registry.counter("ledger.blocks.mined");
    private static final Counter eventsDuplicate = registry.counter("ledger.events.duplicate");
    private static final Counter miningTimeouts = registry.counter("ledger.mining.timeouts");
    private static final Counter miningFailures = registry.counter("ledger.mining.failures");
    private static final Counter verifyFailures = registry.counter("ledger.verify.failures");
    private static final Timer miningTime = registry.timer("ledger.mining.time");

    public static <T> T recordMining(Supplier<T> blockProductionLogic) {
        return miningTime.record(blockProductionLogic);
    }

    public static void incrementBlocks() {
        blocksMined.increment();
    }

    public static void eventRecorded(EventKind kind) {
        registry.counter("ledger.events.recorded", "kind", kind.wireName()).increment();
    }

    /** Reason is a short machine-readable tag such as {@code invalid} or {@code kind_disabled}. */
    public static void eventRejected(String reason) {
        registry.counter("ledger.events.rejected", "reason", reason).increment();
    }

    public static void eventDuplicate() {
        eventsDuplicate.increment();
    }

    public static void miningTimeout() {
        miningTimeouts.increment();
    }

    public static void miningFailure() {
        miningFailures.increment();
    }

    public static void verifyFailure() {
        verifyFailures.increment();
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
