package com.logs.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnalysis(int batchSize, int columnCount, long anomalyCount) {
        recordOutcome("success");

        DistributionSummary.builder("analysis.batch.size")
                .register(registry)
                .record(batchSize);

        DistributionSummary.builder("analysis.feature.columns")
                .register(registry)
                .record(columnCount);

        DistributionSummary.builder("analysis.anomaly.count")
                .register(registry)
                .record(anomalyCount);
    }

    public void recordOutcome(String outcome) {
        Counter.builder("analysis.batch.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
