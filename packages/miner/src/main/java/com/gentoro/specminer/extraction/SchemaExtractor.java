package com.gentoro.specminer.extraction;

import static com.gentoro.specminer.document.SafeNavigator.entries;
import static com.gentoro.specminer.document.SafeNavigator.isMapping;
import static com.gentoro.specminer.document.SafeNavigator.keys;
import static com.gentoro.specminer.document.SafeNavigator.mapping;
import static com.gentoro.specminer.document.SafeNavigator.text;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.specminer.model.DatasetRecord;
import com.gentoro.specminer.model.RecordType;
import com.gentoro.specminer.text.TextCleaner;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Mines {@code components.schemas} descriptions, using the property names as context. */
public class SchemaExtractor implements RecordExtractor {

  static final int MIN_DESCRIPTION_TOKENS = 4;

  @Override
  public ExtractorCapability capability() {
    return ExtractorCapability.SCHEMAS;
  }

  @Override
  public List<DatasetRecord> extract(JsonNode root, String sourceFile) {
    List<DatasetRecord> records = new ArrayList<>();
    JsonNode schemas = mapping(mapping(root, "components"), "schemas");
    for (Map.Entry<String, JsonNode> entry : entries(schemas)) {
      JsonNode schema = entry.getValue();
      if (!isMapping(schema)) {
        continue;
      }

      String description = TextCleaner.clean(text(schema, "description"));
      if (TextCleaner.tokenCount(description) < MIN_DESCRIPTION_TOKENS) {
        continue;
      }

      String fields = String.join(", ", keys(mapping(schema, "properties")));
      String context = "Schema: %s | Fields: %s".formatted(entry.getKey(), fields);
      records.add(
          new DatasetRecord(sourceFile, RecordType.SCHEMA_DESCRIPTION, context, description));
    }
    return records;
  }
}
