package tech.relationsync.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.relationsync.model.DomainObjectType;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer meters for delta application and reconciliation, tagged by domain object type.
 */
@ApplicationScoped
public class SyncMetrics {

    private final MeterRegistry meterRegistry;
    private final Map<DomainObjectType, TypeMetrics> byType = new EnumMap<>(DomainObjectType.class);
    private final Map<String, Counter> failures = new ConcurrentHashMap<>();

    @Inject
    public SyncMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (DomainObjectType type : DomainObjectType.values()) {
            byType.put(type, new TypeMetrics(type));
        }
    }

    public void recordApplied(DomainObjectType type, int added, int removed, Duration elapsed) {
        TypeMetrics metrics = byType.get(type);
        metrics.applied.increment();
        metrics.written.increment(added);
        metrics.deleted.increment(removed);
        metrics.duration.record(elapsed);
    }

    public void recordFailed(DomainObjectType type, String errorKind, Duration elapsed) {
        failures.computeIfAbsent(type + ":" + errorKind, key -> Counter.builder("relation_sync.deltas.failed")
                .tag("type", type.name())
                .tag("error", errorKind)
                .description("Deltas that could not be applied")
                .register(meterRegistry))
            .increment();
        byType.get(type).duration.record(elapsed);
    }

    public void recordDrift(DomainObjectType type) {
        byType.get(type).drift.increment();
    }

    public double appliedCount(DomainObjectType type) {
        return byType.get(type).applied.count();
    }

    public double driftCount(DomainObjectType type) {
        return byType.get(type).drift.count();
    }

    private final class TypeMetrics {
        final Counter applied;
        final Counter written;
        final Counter deleted;
        final Counter drift;
        final Timer duration;

        TypeMetrics(DomainObjectType type) {
            String tag = type.name();
            applied = Counter.builder("relation_sync.deltas.applied")
                .tag("type", tag)
                .description("Deltas applied to the relationship store")
                .register(meterRegistry);
            written = Counter.builder("relation_sync.tuples.written")
                .tag("type", tag)
                .description("Tuples written to the relationship store")
                .register(meterRegistry);
            deleted = Counter.builder("relation_sync.tuples.deleted")
                .tag("type", tag)
                .description("Tuples deleted from the relationship store")
                .register(meterRegistry);
            drift = Counter.builder("relation_sync.drift.detected")
                .tag("type", tag)
                .description("Objects whose stored tuples diverged from their canonical set")
                .register(meterRegistry);
            duration = Timer.builder("relation_sync.duration")
                .tag("type", tag)
                .description("Time to synchronize one domain object")
                .register(meterRegistry);
        }
    }
}
