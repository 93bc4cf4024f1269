package io.civicledger.core.metrics;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.function.Supplier;

public final class LedgerMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter blocksAppended = registry.counter("ledger.blocks.appended");
    private static final Timer miningTime = registry.timer("ledger.mining.time");
    private static final DistributionSummary miningAttempts = DistributionSummary.builder("ledger.mining.attempts")
            .description("Digests computed per mined block")
            .register(registry);
    private static final Counter integrityFailures = Counter.builder("ledger.integrity.failures")
            .description("Validation runs that found a tampered or broken chain")
            .register(registry);
    private static final Counter snapshotFailures = Counter.builder("ledger.snapshot.failures")
            .description("Snapshot saves that failed after an append")
            .register(registry);

    private LedgerMetrics() {}

    public static <T> T recordMining(Supplier<T> miningLogic) {
        return miningTime.record(miningLogic);
    }

    public static void recordAppend(long attempts) {
        blocksAppended.increment();
        miningAttempts.record(attempts);
    }

    public static void incrementIntegrityFailures() {
        integrityFailures.increment();
    }

    public static void incrementSnapshotFailures() {
        snapshotFailures.increment();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName())
                  .append("{stat=")
                  .append(meas.getStatistic())
                  .append("} ")
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
