package io.logscope.engine.model;

import java.time.OffsetDateTime;

public record VolumePoint(OffsetDateTime timestamp, long total, long errors) {
}
