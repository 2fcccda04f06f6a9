package io.logscope.engine.model;

import java.time.OffsetDateTime;
import lombok.Builder;

/**
 * Scope shared by the statistics queries: time range, agent and log type only.
 */
@Builder
public record AggregationFilter(OffsetDateTime from, OffsetDateTime to, String agentId, String type) {
}
