package io.logscope.engine.service;

import io.logscope.engine.config.QueryProperties;
import io.logscope.engine.model.AggregationFilter;
import io.logscope.engine.model.ErrorRateResult;
import io.logscope.engine.model.HttpStatsResult;
import io.logscope.engine.model.LogFilter;
import io.logscope.engine.model.LogQueryResult;
import io.logscope.engine.model.LogSortField;
import io.logscope.engine.model.SearchMode;
import io.logscope.engine.model.SourceCount;
import io.logscope.engine.model.VolumeInterval;
import io.logscope.engine.model.VolumePoint;
import io.logscope.engine.query.ExpressionTooLongException;
import io.logscope.engine.query.ast.Node;
import io.logscope.engine.query.parser.ExpressionParser;
import io.logscope.engine.query.sql.CompiledFilter;
import io.logscope.engine.query.sql.SqlCompiler;
import io.logscope.engine.repository.LogRepository;
import io.logscope.engine.service.dto.LogStats;
import io.logscope.engine.service.dto.QueryParameters;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.clickhouse", name = "enabled", havingValue = "true")
public class LogQueryService {

    private final LogRepository repository;
    private final ExpressionParser parser;
    private final SqlCompiler compiler;
    private final QueryProperties properties;
    private final Executor statsExecutor;

    public LogQueryService(LogRepository repository,
                           ExpressionParser parser,
                           SqlCompiler compiler,
                           QueryProperties properties,
                           @Qualifier("statsExecutor") Executor statsExecutor) {
        this.repository = repository;
        this.parser = parser;
        this.compiler = compiler;
        this.properties = properties;
        this.statsExecutor = statsExecutor;
    }

    /**
     * Length check, parse and compile in one step. Length is measured before any parsing.
     */
    public CompiledFilter compileExpression(String expression) {
        if (expression != null && expression.length() > properties.getMaxExpressionLength()) {
            throw new ExpressionTooLongException(expression.length(), properties.getMaxExpressionLength());
        }
        Node root = parser.parse(expression);
        CompiledFilter compiled = compiler.compile(root);
        if (log.isDebugEnabled()) {
            log.debug("Compiled filter expression '{}' to {} args={}", expression, compiled.sql(), compiled.args());
        }
        return compiled;
    }

    public LogQueryResult search(QueryParameters parameters) {
        return repository.query(toFilter(parameters));
    }

    public long count(QueryParameters parameters) {
        return repository.count(toFilter(parameters));
    }

    public long purgeOlderThan(OffsetDateTime cutoff) {
        return repository.deleteBefore(cutoff);
    }

    public LogFilter toFilter(QueryParameters parameters) {
        int size = parameters.size() > 0
                ? Math.min(parameters.size(), properties.getMaxPageSize())
                : properties.getDefaultPageSize();

        LogFilter.LogFilterBuilder builder = LogFilter.builder()
                .page(Math.max(parameters.page(), 1))
                .pageSize(size)
                .from(parameters.from().orElse(null))
                .to(parameters.to().orElse(null))
                .sortBy(parameters.sortBy().map(LogSortField::fromString).orElse(LogSortField.TIMESTAMP))
                // newest first unless the caller picked a sort column and asked for ascending
                .ascending(parameters.sortBy().filter(StringUtils::hasText).isPresent() && !parameters.sortDesc());

        if (parameters.expression().filter(StringUtils::hasText).isPresent()) {
            return builder.expression(compileExpression(parameters.expression().get())).build();
        }

        List<String> levels = lowerAll(parameters.levels());
        if (levels.size() == 1) {
            builder.level(levels.get(0));
        } else {
            builder.levels(levels);
        }
        List<String> types = lowerAll(parameters.types());
        if (types.size() == 1) {
            builder.type(types.get(0));
        } else {
            builder.types(types);
        }

        return builder
                .agentId(parameters.agentId().filter(StringUtils::hasText).orElse(null))
                .source(parameters.source().filter(StringUtils::hasText).orElse(null))
                .filePath(parameters.filePath().filter(StringUtils::hasText).orElse(null))
                .search(parameters.query().filter(StringUtils::hasText).orElse(null))
                .searchMode(parameters.searchMode().map(SearchMode::fromString).orElse(SearchMode.TOKEN))
                .build();
    }

    /**
     * Runs the four statistics statements concurrently on the stats executor and waits for
     * all of them. The first failure is rethrown as is.
     */
    public LogStats stats(AggregationFilter filter, VolumeInterval interval) {
        CompletableFuture<ErrorRateResult> errorRates =
                CompletableFuture.supplyAsync(() -> repository.errorRates(filter), statsExecutor);
        CompletableFuture<List<SourceCount>> topSources =
                CompletableFuture.supplyAsync(() -> repository.topSources(filter, properties.getTopSourcesLimit()), statsExecutor);
        CompletableFuture<List<VolumePoint>> volume =
                CompletableFuture.supplyAsync(() -> repository.volume(filter, interval), statsExecutor);
        CompletableFuture<HttpStatsResult> httpStats =
                CompletableFuture.supplyAsync(() -> repository.httpStats(filter, properties.getTopUrisLimit()), statsExecutor);

        try {
            CompletableFuture.allOf(errorRates, topSources, volume, httpStats).join();
        } catch (CompletionException e) {
            log.warn("Statistics query failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            throw unwrap(e);
        }
        return new LogStats(errorRates.join(), topSources.join(), volume.join(), httpStats.join());
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("statistics query failed", cause != null ? cause : e);
    }

    private static List<String> lowerAll(List<String> values) {
        return values.stream()
                .filter(StringUtils::hasText)
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .toList();
    }
}
