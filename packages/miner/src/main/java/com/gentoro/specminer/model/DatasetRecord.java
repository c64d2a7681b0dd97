package com.gentoro.specminer.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;

/**
 * One mined (context, label) training example.
 *
 * <p>{@code input_text} and {@code target_text} are the field names the fine-tuning side reads;
 * they must not change.
 *
 * @param sourceFile bare file name of the document the record came from
 * @param type record family
 * @param inputText canonical, human-readable context string
 * @param targetText cleaned natural-language label, never empty
 */
@JsonPropertyOrder({"source_file", "type", "input_text", "target_text"})
public record DatasetRecord(
    @JsonProperty("source_file") String sourceFile,
    @JsonProperty("type") RecordType type,
    @JsonProperty("input_text") String inputText,
    @JsonProperty("target_text") String targetText) {

  public DatasetRecord {
    Objects.requireNonNull(sourceFile, "sourceFile");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(inputText, "inputText");
    if (targetText == null || targetText.isEmpty()) {
      throw new IllegalArgumentException("targetText must not be empty");
    }
  }
}
