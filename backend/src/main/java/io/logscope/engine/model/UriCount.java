package io.logscope.engine.model;

public record UriCount(String uri, long count) {
}
