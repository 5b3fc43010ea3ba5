package com.pharmos.graphql;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Metrics collector for data loader batches
 * Tracks batch count, keys per batch and failed batches, tagged by loader name
 */
@Component
public class DataLoaderMetrics {

    private final MeterRegistry meterRegistry;

    public DataLoaderMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordBatch(String loader, int keyCount) {
        Counter.builder("pharmos.dataloader.batches")
            .description("Number of batch fetches issued to repositories")
            .tag("loader", loader)
            .register(meterRegistry)
            .increment();

        DistributionSummary.builder("pharmos.dataloader.keys")
            .description("Distinct keys per batch fetch")
            .baseUnit("keys")
            .tag("loader", loader)
            .register(meterRegistry)
            .record(keyCount);
    }

    public void recordFailure(String loader) {
        Counter.builder("pharmos.dataloader.failures")
            .description("Number of batch fetches that failed")
            .tag("loader", loader)
            .register(meterRegistry)
            .increment();
    }

    public double getBatchCount(String loader) {
        Counter counter = meterRegistry.find("pharmos.dataloader.batches").tag("loader", loader).counter();
        return counter != null ? counter.count() : 0.0;
    }

    public double getFailureCount(String loader) {
        Counter counter = meterRegistry.find("pharmos.dataloader.failures").tag("loader", loader).counter();
        return counter != null ? counter.count() : 0.0;
    }
}
