package io.logscope.engine.repository;

import io.logscope.engine.model.AggregationFilter;
import io.logscope.engine.model.ErrorRateResult;
import io.logscope.engine.model.HttpStatsResult;
import io.logscope.engine.model.LogFilter;
import io.logscope.engine.model.LogQueryResult;
import io.logscope.engine.model.SourceCount;
import io.logscope.engine.model.VolumeInterval;
import io.logscope.engine.model.VolumePoint;
import java.time.OffsetDateTime;
import java.util.List;

public interface LogRepository extends LogBatchWriter {

    LogQueryResult query(LogFilter filter);

    long count(LogFilter filter);

    /** Schedules deletion of records older than {@code before} and returns how many matched. */
    long deleteBefore(OffsetDateTime before);

    ErrorRateResult errorRates(AggregationFilter filter);

    List<SourceCount> topSources(AggregationFilter filter, int limit);

    List<VolumePoint> volume(AggregationFilter filter, VolumeInterval interval);

    HttpStatsResult httpStats(AggregationFilter filter, int topUriLimit);
}
