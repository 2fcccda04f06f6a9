package io.logscope.engine.config;

import io.logscope.engine.repository.LogRepository;
import io.logscope.engine.service.LogBuffer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "app.clickhouse", name = "enabled", havingValue = "true")
public class LogBufferConfig {

    /** Closed on context shutdown, which flushes whatever is still pending. */
    @Bean(destroyMethod = "close")
    public LogBuffer logBuffer(LogRepository repository, LogBufferProperties properties) {
        return new LogBuffer(repository, properties);
    }

    @Bean
    public LogBufferMetrics logBufferMetrics(LogBuffer logBuffer) {
        return new LogBufferMetrics(logBuffer);
    }
}
