package com.magicfolder.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the classification service.
 */
@Service
public class ClassifierMetrics {

    private final MeterRegistry registry;

    public ClassifierMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRequest(int fileCount, long ms) {
        Counter.builder("magicfolder.requests.total")
                .register(registry)
                .increment();
        Counter.builder("magicfolder.files.total")
                .register(registry)
                .increment(fileCount);
        Timer.builder("magicfolder.request.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param source "hard_rule", "keyword", "escalation" or "default"
     */
    public void recordClassification(String category, String source) {
        Counter.builder("magicfolder.files.classified")
                .tag("category", category)
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "success", "failed" or "unavailable"
     */
    public void recordEscalationCall(String outcome, long ms) {
        Timer.builder("magicfolder.escalation.calls")
                .description("Batch classifier invocations")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param stage "extraction" or "classification"
     */
    public void recordFileError(String stage) {
        Counter.builder("magicfolder.file.errors")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordProtocolError() {
        Counter.builder("magicfolder.protocol.errors")
                .description("Requests rejected as malformed or empty")
                .register(registry)
                .increment();
    }
}
