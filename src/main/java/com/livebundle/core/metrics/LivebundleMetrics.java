package com.livebundle.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for sessions and rebuilds.
 */
@Service
public class LivebundleMetrics {

    private final MeterRegistry registry;

    public LivebundleMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBuildDuration(String target, boolean success, long ms) {
        Timer.builder("livebundle.build.duration")
                .description("Compile time per bundle target")
                .tag("target", target)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "completed", "failed", "skipped" or "not_found"
     */
    public void recordRebuild(String outcome) {
        Counter.builder("livebundle.rebuilds.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a rebuild request dropped because a build for the same session was already running.
     */
    public void recordDeduplicated() {
        Counter.builder("livebundle.rebuilds.deduplicated")
                .description("Rebuild requests skipped while a build was in flight")
                .register(registry)
                .increment();
    }

    public void recordBundleSize(String target, long bytes) {
        DistributionSummary.builder("livebundle.bundle.size")
                .baseUnit("bytes")
                .tag("target", target)
                .register(registry)
                .record(bytes);
    }

    public void recordSessionCreated() {
        Counter.builder("livebundle.sessions.created")
                .register(registry)
                .increment();
    }

    public void recordSessionRemoved() {
        Counter.builder("livebundle.sessions.removed")
                .register(registry)
                .increment();
    }
}
