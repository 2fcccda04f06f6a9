package io.logscope.engine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "app.query")
public class QueryProperties {

    private int maxExpressionLength = 1000;

    private int defaultPageSize = 50;

    private int maxPageSize = 1000;

    private int topSourcesLimit = 10;

    private int topUrisLimit = 10;

    /** Worker threads running the statistics statements in parallel. */
    private int statsThreads = 4;
}
