package com.gentoro.specminer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted statistics of one run. {@code typeBreakdown} is keyed by record type wire name and
 * iterates by descending count.
 */
@JsonPropertyOrder({"total_examples", "train_size", "val_size", "test_size", "type_breakdown"})
public record DatasetSummary(
    @JsonProperty("total_examples") int totalExamples,
    @JsonProperty("train_size") int trainSize,
    @JsonProperty("val_size") int valSize,
    @JsonProperty("test_size") int testSize,
    @JsonProperty("type_breakdown") Map<String, Integer> typeBreakdown) {

  public DatasetSummary {
    typeBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(typeBreakdown));
  }
}
