package io.logscope.engine.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.buffer")
public class LogBufferProperties {

    /** Pending records that trigger an immediate flush. */
    private int batchSize = 1000;

    private Duration flushInterval = Duration.ofSeconds(5);

    /** Hard cap on pending records; the oldest are dropped beyond it. */
    private int maxSize = 100_000;

    /** How long shutdown waits for an in-flight timer flush before the final flush. */
    private Duration shutdownTimeout = Duration.ofSeconds(30);
}
