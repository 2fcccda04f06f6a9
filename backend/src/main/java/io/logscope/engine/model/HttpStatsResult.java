package io.logscope.engine.model;

import java.util.List;

/**
 * Status class totals over records with an HTTP status, plus the busiest URIs.
 */
public record HttpStatsResult(long total2xx, long total3xx, long total4xx, long total5xx, List<UriCount> topUris) {

    public HttpStatsResult {
        topUris = topUris == null ? List.of() : List.copyOf(topUris);
    }

    public HttpStatsResult withTopUris(List<UriCount> uris) {
        return new HttpStatsResult(total2xx, total3xx, total4xx, total5xx, uris);
    }
}
