package com.gentoro.specminer.utility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.specminer.exception.SerializationException;

public class JacksonUtility {
  // Pretty-printed, for the summary object.
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .enable(SerializationFeature.INDENT_OUTPUT);

  // One value per line; non-ASCII characters are written as-is.
  private static final ObjectMapper JSON_LINES_MAPPER =
      new ObjectMapper().configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static ObjectWriter getJsonLinesWriter() {
    return JSON_LINES_MAPPER.writer();
  }

  /** Single-line JSON rendering of a tree node. */
  public static String toCompactJson(JsonNode node) {
    try {
      return JSON_LINES_MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to serialize node to JSON", e);
    }
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }
}
