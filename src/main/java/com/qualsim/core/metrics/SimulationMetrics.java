package com.qualsim.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for simulation runs.
 */
@Service
public class SimulationMetrics {

    private final MeterRegistry registry;

    public SimulationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordNodeCreated(String status) {
        Counter.builder("qualsim.nodes.created")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordNodeMerged() {
        Counter.builder("qualsim.nodes.merged")
                .description("Branches folded into an existing node of the same layer")
                .register(registry)
                .increment();
    }

    public void recordBranchPoints(int count) {
        Counter.builder("qualsim.branch.points")
                .register(registry)
                .increment(count);
    }

    public void recordLayerDuration(String action, long ms) {
        Timer.builder("qualsim.layer.duration")
                .tag("action", action)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordLayerWidth(int width) {
        DistributionSummary.builder("qualsim.layer.width")
                .register(registry)
                .record(width);
    }

    public void recordSimulationResult(String outcome) {
        Counter.builder("qualsim.simulations.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
