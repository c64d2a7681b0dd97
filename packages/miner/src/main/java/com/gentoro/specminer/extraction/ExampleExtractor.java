package com.gentoro.specminer.extraction;

import static com.gentoro.specminer.document.SafeNavigator.entries;
import static com.gentoro.specminer.document.SafeNavigator.get;
import static com.gentoro.specminer.document.SafeNavigator.isMapping;
import static com.gentoro.specminer.document.SafeNavigator.mapping;
import static com.gentoro.specminer.document.SafeNavigator.text;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.specminer.model.DatasetRecord;
import com.gentoro.specminer.model.RecordType;
import com.gentoro.specminer.text.TextCleaner;
import com.gentoro.specminer.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mines {@code components.examples}.
 *
 * <p>An example with both a summary and a description teaches the description; one with only a
 * summary teaches the summary. The example value is part of the context, rendered as text and cut
 * to {@value #MAX_VALUE_CHARS} characters.
 */
public class ExampleExtractor implements RecordExtractor {

  static final int MAX_VALUE_CHARS = 200;

  @Override
  public ExtractorCapability capability() {
    return ExtractorCapability.EXAMPLES;
  }

  @Override
  public List<DatasetRecord> extract(JsonNode root, String sourceFile) {
    List<DatasetRecord> records = new ArrayList<>();
    JsonNode examples = mapping(mapping(root, "components"), "examples");
    for (Map.Entry<String, JsonNode> entry : entries(examples)) {
      String name = entry.getKey();
      JsonNode example = entry.getValue();
      if (!isMapping(example)) {
        continue;
      }

      String summary = text(example, "summary");
      String description = text(example, "description");
      if (summary.isEmpty()) {
        continue;
      }

      String data = valueText(get(example, "value"));
      if (!description.isEmpty()) {
        String target = TextCleaner.clean(description);
        if (!target.isEmpty()) {
          String context = "Example: %s | Summary: %s | Data: %s".formatted(name, summary, data);
          records.add(
              new DatasetRecord(sourceFile, RecordType.EXAMPLE_DESCRIPTION, context, target));
        }
      } else {
        String target = TextCleaner.clean(summary);
        if (!target.isEmpty()) {
          String context = "Example: %s | Data: %s".formatted(name, data);
          records.add(new DatasetRecord(sourceFile, RecordType.EXAMPLE_SUMMARY, context, target));
        }
      }
    }
    return records;
  }

  /** Scalars render as their text, containers as compact JSON, null/absent as empty. */
  static String valueText(JsonNode value) {
    String rendered;
    if (value == null || value.isMissingNode() || value.isNull()) {
      rendered = "";
    } else if (value.isValueNode()) {
      rendered = value.asText("");
    } else {
      rendered = JacksonUtility.toCompactJson(value);
    }
    return TextCleaner.truncate(rendered, MAX_VALUE_CHARS);
  }
}
