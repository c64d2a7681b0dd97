package com.gentoro.specminer.dataset;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.specminer.model.DatasetRecord;
import com.gentoro.specminer.model.DatasetSplit;
import com.gentoro.specminer.model.DatasetSummary;
import com.gentoro.specminer.model.MinedDataset;
import com.gentoro.specminer.model.RecordType;
import com.gentoro.specminer.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DatasetWriterTest {

  private static final DatasetRecord OPERATION =
      new DatasetRecord(
          "catalog.json",
          RecordType.OPERATION_DESCRIPTION,
          "Method: GET | Path: /catalog | Summary: List catalog | Tags: catalog",
          "Lists every product with prices in euros – €.");
  private static final DatasetRecord SCHEMA =
      new DatasetRecord(
          "store.yaml",
          RecordType.SCHEMA_DESCRIPTION,
          "Schema: \"Quoted\" | Fields: id",
          "A schema whose name needs escaping.");
  private static final DatasetRecord EXAMPLE =
      new DatasetRecord(
          "store.yaml", RecordType.EXAMPLE_SUMMARY, "Example: Min | Data: 1", "Only required");

  private static MinedDataset dataset() {
    List<DatasetRecord> records = List.of(OPERATION, SCHEMA, EXAMPLE);
    DatasetSplit split = new DatasetSplit(List.of(OPERATION, SCHEMA), List.of(), List.of(EXAMPLE));
    Map<String, Integer> breakdown = new LinkedHashMap<>();
    breakdown.put("example_summary", 1);
    breakdown.put("operation_description", 1);
    breakdown.put("schema_description", 1);
    return new MinedDataset(records, split, new DatasetSummary(3, 2, 0, 1, breakdown));
  }

  @Test
  @DisplayName("split files hold one compact record per line with fixed field order")
  void writesJsonLines(@TempDir Path out) throws IOException {
    new DatasetWriter(out).write(dataset());

    String train = Files.readString(out.resolve(DatasetWriter.TRAIN_FILE), StandardCharsets.UTF_8);
    List<String> lines = train.lines().toList();
    assertEquals(2, lines.size());
    assertTrue(train.endsWith("\n"));
    assertEquals(
        "{\"source_file\":\"catalog.json\",\"type\":\"operation_description\","
            + "\"input_text\":\"Method: GET | Path: /catalog | Summary: List catalog | Tags: catalog\","
            + "\"target_text\":\"Lists every product with prices in euros – €.\"}",
        lines.get(0));

    JsonNode second = JacksonUtility.getJsonMapper().readTree(lines.get(1));
    assertEquals("Schema: \"Quoted\" | Fields: id", second.get("input_text").asText());
  }

  @Test
  @DisplayName("empty partitions produce empty files")
  void emptyPartition(@TempDir Path out) throws IOException {
    new DatasetWriter(out).write(dataset());

    assertEquals(0, Files.size(out.resolve(DatasetWriter.VAL_FILE)));
    assertEquals(1, Files.readAllLines(out.resolve(DatasetWriter.TEST_FILE)).size());
  }

  @Test
  @DisplayName("the summary is a pretty-printed object with the breakdown order preserved")
  void writesSummary(@TempDir Path out) throws IOException {
    new DatasetWriter(out).write(dataset());

    String text = Files.readString(out.resolve(DatasetWriter.SUMMARY_FILE));
    assertTrue(text.lines().count() > 1);

    JsonNode summary = JacksonUtility.getJsonMapper().readTree(text);
    assertEquals(3, summary.get("total_examples").asInt());
    assertEquals(2, summary.get("train_size").asInt());
    assertEquals(0, summary.get("val_size").asInt());
    assertEquals(1, summary.get("test_size").asInt());
    List<String> fields = new ArrayList<>();
    summary.fieldNames().forEachRemaining(fields::add);
    assertEquals(
        List.of("total_examples", "train_size", "val_size", "test_size", "type_breakdown"), fields);
    List<String> types = new ArrayList<>();
    summary.get("type_breakdown").fieldNames().forEachRemaining(types::add);
    assertEquals(List.of("example_summary", "operation_description", "schema_description"), types);
  }

  @Test
  @DisplayName("the output directory is created and no temporary files are left behind")
  void createsDirectory(@TempDir Path tmp) throws IOException {
    Path out = tmp.resolve("nested/out");

    new DatasetWriter(out).write(dataset());

    try (Stream<Path> files = Files.list(out)) {
      assertEquals(
          List.of("dataset_summary.json", "test.json", "train.json", "val.json"),
          files.map(p -> p.getFileName().toString()).sorted().toList());
    }
  }
}
