package io.logscope.engine.config;

import io.logscope.engine.query.FieldRegistry;
import io.logscope.engine.query.parser.ExpressionParser;
import io.logscope.engine.query.sql.SqlCompiler;
import io.logscope.engine.repository.LogStatementBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class QueryEngineConfig {

    @Bean
    public FieldRegistry fieldRegistry() {
        return FieldRegistry.defaults();
    }

    @Bean
    public ExpressionParser expressionParser(FieldRegistry fieldRegistry) {
        return new ExpressionParser(fieldRegistry);
    }

    @Bean
    public SqlCompiler sqlCompiler(FieldRegistry fieldRegistry) {
        return new SqlCompiler(fieldRegistry);
    }

    @Bean
    public LogStatementBuilder logStatementBuilder() {
        return new LogStatementBuilder();
    }

    @Bean(name = "statsExecutor")
    public ThreadPoolTaskExecutor statsExecutor(QueryProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, properties.getStatsThreads()));
        executor.setMaxPoolSize(Math.max(1, properties.getStatsThreads()));
        executor.setThreadNamePrefix("log-stats-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
