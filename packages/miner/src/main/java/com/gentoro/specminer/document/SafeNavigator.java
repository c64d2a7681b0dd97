package com.gentoro.specminer.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Total, non-throwing field access over untyped document trees.
 *
 * <p>A document node is a Mapping ({@code ObjectNode}), a Sequence ({@code ArrayNode}), a Scalar
 * ({@code ValueNode}) or Null ({@code NullNode}, or {@code MissingNode} for "absent"), and any of
 * them may appear anywhere. Lookups only descend into Mappings; every other shape, including a
 * {@code null} reference, behaves as if the key were absent. Callers therefore receive either a
 * real value or their default and never need a type check of their own.
 */
public final class SafeNavigator {

  private SafeNavigator() {}

  public static boolean isMapping(JsonNode node) {
    return node != null && node.isObject();
  }

  /**
   * Returns {@code node[key]} when {@code node} is a Mapping containing {@code key}, else {@code
   * defaultValue}. A key that is present with an explicit null value yields the null node.
   */
  public static JsonNode get(JsonNode node, String key, JsonNode defaultValue) {
    if (!isMapping(node) || key == null) {
      return defaultValue;
    }
    JsonNode value = node.get(key);
    return value != null ? value : defaultValue;
  }

  /** {@link #get(JsonNode, String, JsonNode)} with the missing node as default. */
  public static JsonNode get(JsonNode node, String key) {
    return get(node, key, MissingNode.getInstance());
  }

  /**
   * Text of a scalar child. Absent keys, explicit nulls and container values (which have no
   * meaningful text) all yield the empty string.
   */
  public static String text(JsonNode node, String key) {
    return scalarText(get(node, key));
  }

  /** Text of a scalar node; empty for null, missing and container nodes. */
  public static String scalarText(JsonNode node) {
    if (node == null || !node.isValueNode()) {
      return "";
    }
    return node.asText("");
  }

  /** The child under {@code key} if it is a Mapping, otherwise the missing node. */
  public static JsonNode mapping(JsonNode node, String key) {
    JsonNode child = get(node, key);
    return isMapping(child) ? child : MissingNode.getInstance();
  }

  /** Key/value pairs of a Mapping in document order; empty for any other shape. */
  public static List<Map.Entry<String, JsonNode>> entries(JsonNode node) {
    if (!isMapping(node)) {
      return Collections.emptyList();
    }
    List<Map.Entry<String, JsonNode>> result = new ArrayList<>(node.size());
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      result.add(fields.next());
    }
    return result;
  }

  /** Keys of a Mapping in document order; empty for any other shape. */
  public static List<String> keys(JsonNode node) {
    if (!isMapping(node)) {
      return Collections.emptyList();
    }
    List<String> result = new ArrayList<>(node.size());
    node.fieldNames().forEachRemaining(result::add);
    return result;
  }

  /**
   * Text of the scalar elements of a Sequence child. Non-sequence values yield an empty list;
   * null and container elements are skipped.
   */
  public static List<String> scalarList(JsonNode node, String key) {
    JsonNode child = get(node, key);
    if (child == null || !child.isArray()) {
      return Collections.emptyList();
    }
    List<String> result = new ArrayList<>(child.size());
    for (JsonNode element : child) {
      if (element.isValueNode() && !element.isNull()) {
        result.add(element.asText(""));
      }
    }
    return result;
  }
}
