package com.gentoro.specminer;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.specminer.dataset.DatasetWriter;
import com.gentoro.specminer.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SpecMinerAppTest {

  private static int run(Path out, String... extra) {
    List<String> args = new ArrayList<>();
    args.add("--root-dir");
    args.add(TestCorpus.root().toString());
    args.add("--output-dir");
    args.add(out.toString());
    args.addAll(List.of(extra));
    return SpecMinerApp.execute(args.toArray(String[]::new));
  }

  private static List<JsonNode> readLines(Path file) throws IOException {
    List<JsonNode> nodes = new ArrayList<>();
    for (String line : Files.readAllLines(file)) {
      nodes.add(JacksonUtility.getJsonMapper().readTree(line));
    }
    return nodes;
  }

  @Test
  @DisplayName("the fixture corpus is mined into deduplicated, disjoint split files")
  void endToEnd(@TempDir Path out) throws IOException {
    assertEquals(SpecMinerApp.EXIT_OK, run(out));

    List<JsonNode> train = readLines(out.resolve(DatasetWriter.TRAIN_FILE));
    List<JsonNode> val = readLines(out.resolve(DatasetWriter.VAL_FILE));
    List<JsonNode> test = readLines(out.resolve(DatasetWriter.TEST_FILE));
    assertEquals(5, train.size());
    assertEquals(1, val.size());
    assertEquals(1, test.size());

    Set<String> inputs = new HashSet<>();
    for (JsonNode record : concat(train, val, test)) {
      assertTrue(inputs.add(record.get("input_text").asText()), "duplicate input_text");
      assertFalse(record.get("target_text").asText().isEmpty());
    }
    assertTrue(
        concat(train, val, test).stream()
            .anyMatch(
                r ->
                    r.get("target_text")
                        .asText()
                        .equals(
                            "A different description for the same operation context string here.")),
        "the first occurrence of a duplicated context wins");

    JsonNode summary =
        JacksonUtility.getJsonMapper().readTree(out.resolve(DatasetWriter.SUMMARY_FILE).toFile());
    assertEquals(7, summary.get("total_examples").asInt());
    assertEquals(5, summary.get("train_size").asInt());
    JsonNode breakdown = summary.get("type_breakdown");
    assertEquals(3, breakdown.get("operation_description").asInt());
    assertEquals(2, breakdown.get("schema_description").asInt());
    assertEquals(1, breakdown.get("example_description").asInt());
    assertEquals(1, breakdown.get("example_summary").asInt());
  }

  @Test
  @DisplayName("two runs over the same corpus produce identical files")
  void reproducible(@TempDir Path first, @TempDir Path second) throws IOException {
    assertEquals(SpecMinerApp.EXIT_OK, run(first));
    assertEquals(SpecMinerApp.EXIT_OK, run(second));

    for (String name :
        List.of(
            DatasetWriter.TRAIN_FILE,
            DatasetWriter.VAL_FILE,
            DatasetWriter.TEST_FILE,
            DatasetWriter.SUMMARY_FILE)) {
      assertEquals(
          Files.readString(first.resolve(name)), Files.readString(second.resolve(name)), name);
    }
  }

  @Test
  @DisplayName("the extractor selection on the command line limits the record families")
  void extractorOverride(@TempDir Path out) throws IOException {
    assertEquals(SpecMinerApp.EXIT_OK, run(out, "--extractors", "operations"));

    JsonNode summary =
        JacksonUtility.getJsonMapper().readTree(out.resolve(DatasetWriter.SUMMARY_FILE).toFile());
    assertEquals(3, summary.get("total_examples").asInt());
    assertEquals(1, summary.get("type_breakdown").size());
  }

  @Test
  @DisplayName("a dry run writes nothing")
  void dryRun(@TempDir Path out) throws IOException {
    assertEquals(SpecMinerApp.EXIT_OK, run(out, "--mode", "dry-run"));

    assertTrue(isEmpty(out));
  }

  @Test
  @DisplayName("an empty corpus exits with status 1 and writes nothing")
  void emptyCorpus(@TempDir Path root, @TempDir Path out) throws IOException {
    int status =
        SpecMinerApp.execute(
            new String[] {"--root-dir", root.toString(), "--output-dir", out.toString()});

    assertEquals(SpecMinerApp.EXIT_EMPTY_CORPUS, status);
    assertTrue(isEmpty(out));
  }

  @Test
  @DisplayName("usage problems exit with status 2, help with 0")
  void argumentErrors(@TempDir Path dir) {
    assertEquals(SpecMinerApp.EXIT_OK, SpecMinerApp.execute(new String[] {"--mode", "help"}));
    assertEquals(
        SpecMinerApp.EXIT_INVALID_ARGUMENTS,
        SpecMinerApp.execute(new String[] {"--mode", "train"}));
    assertEquals(
        SpecMinerApp.EXIT_INVALID_ARGUMENTS,
        SpecMinerApp.execute(
            new String[] {"--config-file", dir.resolve("absent.yaml").toString()}));
    assertEquals(
        SpecMinerApp.EXIT_INVALID_ARGUMENTS,
        SpecMinerApp.execute(new String[] {"--extractors", "parameters"}));
  }

  @SafeVarargs
  private static List<JsonNode> concat(List<JsonNode>... parts) {
    List<JsonNode> all = new ArrayList<>();
    for (List<JsonNode> part : parts) {
      all.addAll(part);
    }
    return all;
  }

  private static boolean isEmpty(Path dir) throws IOException {
    try (Stream<Path> entries = Files.list(dir)) {
      return entries.findAny().isEmpty();
    }
  }
}
