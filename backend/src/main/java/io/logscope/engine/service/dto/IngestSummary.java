package io.logscope.engine.service.dto;

public record IngestSummary(String sessionId, String origin, long total, long accepted, long failed) {
}
