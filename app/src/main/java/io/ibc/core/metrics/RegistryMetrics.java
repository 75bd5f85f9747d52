package io.ibc.core.metrics;

import io.ibc.core.client.Outcome;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.EnumMap;
import java.util.Map;

public final class RegistryMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter clientsCreated = Counter.builder("registry.clients.created")
            .description("Clients allocated by createClient")
            .register(registry);
    private static final Counter invariantViolations = Counter.builder("registry.invariant.violations")
            .description("Allocator/store invariant violations (should stay at zero)")
            .register(registry);
    private static final Map<Outcome, Counter> updates = new EnumMap<>(Outcome.class);

    static {
        for (Outcome outcome : Outcome.values()) {
            if (outcome == Outcome.CREATE_OK) {
                continue;
            }
            updates.put(outcome, Counter.builder("registry.client.updates")
                    .description("updateClient results by outcome")
                    .tag("outcome", outcome.name())
                    .register(registry));
        }
    }

    private RegistryMetrics() {}

    public static void incrementCreated() {
        clientsCreated.increment();
    }

    public static void recordUpdate(Outcome outcome) {
        Counter counter = updates.get(outcome);
        if (counter == null) {
            throw new IllegalArgumentException("Not an update outcome: " + outcome);
        }
        counter.increment();
    }

    public static void incrementInvariantViolations() {
        invariantViolations.increment();
    }

    public static double createdCount() {
        return clientsCreated.count();
    }

    public static double updateCount(Outcome outcome) {
        Counter counter = updates.get(outcome);
        return counter == null ? 0.0 : counter.count();
    }

    public static double invariantViolationCount() {
        return invariantViolations.count();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                for (Tag tag : m.getId().getTags()) {
                    sb.append('{').append(tag.getKey()).append('=').append(tag.getValue()).append('}');
                }
                sb.append("{stat=")
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
