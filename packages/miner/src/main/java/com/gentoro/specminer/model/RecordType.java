package com.gentoro.specminer.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Record family of a mined example. The wire names are part of the output file format. */
public enum RecordType {
  OPERATION_DESCRIPTION("operation_description"),
  EXAMPLE_DESCRIPTION("example_description"),
  EXAMPLE_SUMMARY("example_summary"),
  SCHEMA_DESCRIPTION("schema_description");

  private final String wireName;

  RecordType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @Override
  public String toString() {
    return wireName;
  }
}
