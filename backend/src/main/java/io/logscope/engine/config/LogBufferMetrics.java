package io.logscope.engine.config;

import io.logscope.engine.service.LogBuffer;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Exposes the ingestion buffer counters to Micrometer.
 */
public class LogBufferMetrics implements MeterBinder {

    private final LogBuffer buffer;

    public LogBufferMetrics(LogBuffer buffer) {
        this.buffer = buffer;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("logscope.buffer.pending", buffer, b -> b.stats().pending())
                .description("Log records waiting to be written")
                .register(registry);
        FunctionCounter.builder("logscope.buffer.dropped", buffer, b -> b.stats().dropped())
                .description("Log records discarded because the buffer was full")
                .register(registry);
        FunctionCounter.builder("logscope.buffer.flushes", buffer, b -> b.stats().flushes())
                .description("Successful batch inserts")
                .register(registry);
        FunctionCounter.builder("logscope.buffer.inserted", buffer, b -> b.stats().inserted())
                .description("Log records written by successful flushes")
                .register(registry);
    }
}
