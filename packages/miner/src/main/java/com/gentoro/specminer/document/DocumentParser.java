package com.gentoro.specminer.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.specminer.exception.ExceptionUtil;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Loads a single file into an untyped document tree.
 *
 * <p>Every file is read with the YAML grammar, which also accepts JSON. Anchors, aliases and
 * {@code <<} merge keys are resolved while loading, only standard YAML tags are constructed, and
 * a stream holding more than one document is rejected. Parse errors never escape: they come back
 * as a failed {@link ParseOutcome} carrying a short reason. An empty file yields the missing node.
 */
public class DocumentParser {
  private static final org.slf4j.Logger log =
      com.gentoro.specminer.logging.LoggingService.getLogger(DocumentParser.class);

  /** SnakeYAML's own default is 3 MB, which many published API descriptions exceed. */
  public static final int DEFAULT_MAX_CODE_POINTS = 50_000_000;

  private static final int MAX_REASON_LENGTH = 200;

  private final int maxCodePoints;

  public DocumentParser() {
    this(DEFAULT_MAX_CODE_POINTS);
  }

  public DocumentParser(int maxCodePoints) {
    this.maxCodePoints = maxCodePoints;
  }

  public ParseOutcome parse(Path file) {
    String fileName = file.getFileName().toString();
    byte[] content;
    try {
      content = Files.readAllBytes(file);
    } catch (IOException e) {
      log.warn("Skipping unreadable file {}: {}", file, e.getMessage());
      return ParseOutcome.failure(fileName, ExceptionUtil.shortReason(e, MAX_REASON_LENGTH));
    }
    return parse(fileName, content);
  }

  public ParseOutcome parse(String fileName, byte[] content) {
    try {
      // Yaml instances are not thread-safe; the pipeline may parse on several workers
      Object loaded = newYaml().load(new ByteArrayInputStream(content));
      JsonNode root =
          loaded == null
              ? MissingNode.getInstance()
              : toNode(loaded, Collections.newSetFromMap(new IdentityHashMap<>()));
      return ParseOutcome.success(fileName, root);
    } catch (RuntimeException e) {
      // YAMLException for malformed input and for exceeded loader limits
      log.warn("Skipping malformed file {}: {}", fileName, firstLine(e.getMessage()));
      return ParseOutcome.failure(fileName, ExceptionUtil.shortReason(e, MAX_REASON_LENGTH));
    }
  }

  private Yaml newYaml() {
    LoaderOptions loaderOptions = new LoaderOptions();
    loaderOptions.setCodePointLimit(maxCodePoints);
    return new Yaml(new SafeConstructor(loaderOptions));
  }

  /**
   * Converts a value built by {@link SafeConstructor} into a tree node. Mapping keys that are not
   * strings are rendered with {@link String#valueOf}; a collection that contains itself through an
   * alias is cut at the repetition and becomes null.
   */
  static JsonNode toNode(Object value, Set<Object> ancestors) {
    JsonNodeFactory nodes = JsonNodeFactory.instance;
    if (value == null) {
      return nodes.nullNode();
    }
    if (value instanceof Map<?, ?> map) {
      if (!ancestors.add(map)) {
        return nodes.nullNode();
      }
      ObjectNode object = nodes.objectNode();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        object.set(String.valueOf(entry.getKey()), toNode(entry.getValue(), ancestors));
      }
      ancestors.remove(map);
      return object;
    }
    if (value instanceof Collection<?> collection) {
      if (!ancestors.add(collection)) {
        return nodes.nullNode();
      }
      ArrayNode array = nodes.arrayNode();
      for (Object element : collection) {
        array.add(toNode(element, ancestors));
      }
      ancestors.remove(collection);
      return array;
    }
    if (value instanceof String text) {
      return nodes.textNode(text);
    }
    if (value instanceof Boolean bool) {
      return nodes.booleanNode(bool);
    }
    if (value instanceof Integer i) {
      return nodes.numberNode(i);
    }
    if (value instanceof Long l) {
      return nodes.numberNode(l);
    }
    if (value instanceof BigInteger big) {
      return nodes.numberNode(big);
    }
    if (value instanceof Double d) {
      return nodes.numberNode(d);
    }
    if (value instanceof BigDecimal decimal) {
      return nodes.numberNode(decimal);
    }
    if (value instanceof byte[] binary) {
      return nodes.binaryNode(binary);
    }
    if (value instanceof Date date) {
      return nodes.textNode(date.toInstant().toString());
    }
    return nodes.textNode(String.valueOf(value));
  }

  private static String firstLine(String message) {
    if (message == null) return "";
    int nl = message.indexOf('\n');
    return nl < 0 ? message : message.substring(0, nl);
  }
}
