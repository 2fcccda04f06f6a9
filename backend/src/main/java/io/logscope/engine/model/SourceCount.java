package io.logscope.engine.model;

public record SourceCount(String source, long count, long errorCount) {
}
