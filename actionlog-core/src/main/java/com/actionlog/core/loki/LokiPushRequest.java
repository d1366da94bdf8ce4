package com.actionlog.core.loki;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Body of {@code POST /loki/api/v1/push}: streams keyed by a label set, each holding
 * {@code [unix-nanos, line]} pairs. This client always sends one stream with one value.
 */
public record LokiPushRequest(@JsonProperty("streams") List<Stream> streams) {

    public static LokiPushRequest of(Map<String, String> labels, Instant timestamp, String line) {
        Map<String, String> sorted = new TreeMap<>();
        labels.forEach((k, v) -> sorted.put(k, v == null ? "" : v));
        List<String> value = List.of(Long.toString(unixNanos(timestamp)), line == null ? "" : line);
        return new LokiPushRequest(List.of(new Stream(sorted, List.of(value))));
    }

    static long unixNanos(Instant ts) {
        return Math.addExact(Math.multiplyExact(ts.getEpochSecond(), 1_000_000_000L), ts.getNano());
    }

    public record Stream(
            @JsonProperty("stream") Map<String, String> labels, @JsonProperty("values") List<List<String>> values) {}
}
