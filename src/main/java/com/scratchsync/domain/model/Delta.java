package com.scratchsync.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Lifecycle classification of entity IDs between two snapshots.
 */
public record Delta(
    @JsonProperty("new") List<String> newIds,
    @JsonProperty("continuing") List<String> continuing,
    @JsonProperty("ended") List<String> ended,
    @JsonProperty("counts") Map<String, Integer> counts
) {
    public static Delta empty() {
        return new Delta(List.of(), List.of(), List.of(), Map.of("index", 0, "previous", 0));
    }
}
