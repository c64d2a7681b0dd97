package com.gentoro.specminer.extraction;

import static com.gentoro.specminer.document.SafeNavigator.entries;
import static com.gentoro.specminer.document.SafeNavigator.isMapping;
import static com.gentoro.specminer.document.SafeNavigator.mapping;
import static com.gentoro.specminer.document.SafeNavigator.scalarList;
import static com.gentoro.specminer.document.SafeNavigator.text;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.specminer.model.DatasetRecord;
import com.gentoro.specminer.model.RecordType;
import com.gentoro.specminer.text.TextCleaner;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mines operation descriptions from {@code paths}.
 *
 * <p>Every Mapping-valued key of a path item other than the shared path-level fields is taken to
 * be an HTTP method. The method name is not checked against a list, since real documents carry
 * vendor and misspelled methods too. Descriptions of five tokens or fewer ("Returns 200 OK") are
 * dropped.
 */
public class OperationExtractor implements RecordExtractor {

  static final Set<String> PATH_LEVEL_FIELDS =
      Set.of("summary", "description", "parameters", "servers", "$ref");

  static final int MIN_DESCRIPTION_TOKENS = 6;

  @Override
  public ExtractorCapability capability() {
    return ExtractorCapability.OPERATIONS;
  }

  @Override
  public List<DatasetRecord> extract(JsonNode root, String sourceFile) {
    List<DatasetRecord> records = new ArrayList<>();
    for (Map.Entry<String, JsonNode> pathEntry : entries(mapping(root, "paths"))) {
      String path = pathEntry.getKey();
      for (Map.Entry<String, JsonNode> opEntry : entries(pathEntry.getValue())) {
        String methodKey = opEntry.getKey();
        JsonNode operation = opEntry.getValue();
        if (PATH_LEVEL_FIELDS.contains(methodKey) || !isMapping(operation)) {
          continue;
        }

        String description = TextCleaner.clean(text(operation, "description"));
        if (TextCleaner.tokenCount(description) < MIN_DESCRIPTION_TOKENS) {
          continue;
        }

        String summary = text(operation, "summary");
        String tags = String.join(", ", scalarList(operation, "tags"));
        String context =
            "Method: %s | Path: %s | Summary: %s | Tags: %s"
                .formatted(methodKey.toUpperCase(Locale.ROOT), path, summary, tags);
        records.add(
            new DatasetRecord(sourceFile, RecordType.OPERATION_DESCRIPTION, context, description));
      }
    }
    return records;
  }
}
