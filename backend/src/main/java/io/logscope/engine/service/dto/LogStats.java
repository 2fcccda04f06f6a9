package io.logscope.engine.service.dto;

import io.logscope.engine.model.ErrorRateResult;
import io.logscope.engine.model.HttpStatsResult;
import io.logscope.engine.model.SourceCount;
import io.logscope.engine.model.VolumePoint;
import java.util.List;

public record LogStats(
        ErrorRateResult errorRates,
        List<SourceCount> topSources,
        List<VolumePoint> volume,
        HttpStatsResult httpStats) {
}
