package com.gentoro.specminer.extraction;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.specminer.document.DocumentParser;
import com.gentoro.specminer.model.DatasetRecord;
import com.gentoro.specminer.model.RecordType;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OperationExtractorTest {

  private final OperationExtractor extractor = new OperationExtractor();

  private static JsonNode yaml(String content) {
    return new DocumentParser().parse("test.yaml", content.getBytes(StandardCharsets.UTF_8)).document();
  }

  @Test
  @DisplayName("a documented GET operation yields one record")
  void singleOperation() {
    JsonNode root =
        yaml(
            """
            paths:
              /users:
                get:
                  summary: Get users
                  description: Returns a list of users available in the system for pagination
                  tags: [users]
            """);

    List<DatasetRecord> records = extractor.extract(root, "users.yaml");

    assertEquals(1, records.size());
    DatasetRecord record = records.get(0);
    assertEquals(RecordType.OPERATION_DESCRIPTION, record.type());
    assertEquals("users.yaml", record.sourceFile());
    assertEquals("Method: GET | Path: /users | Summary: Get users | Tags: users", record.inputText());
    assertEquals(
        "Returns a list of users available in the system for pagination", record.targetText());
  }

  @Test
  @DisplayName("descriptions of five tokens or fewer are dropped")
  void shortDescriptionsDropped() {
    JsonNode root =
        yaml(
            """
            paths:
              /health:
                get:
                  description: Returns 200 OK when healthy
                post:
                  description: "<b>Five</b> tokens after <i>markup</i> removal"
                put:
                  description: Enough tokens survive the markup removal here
            """);

    List<DatasetRecord> records = extractor.extract(root, "health.yaml");

    assertEquals(1, records.size());
    assertTrue(records.get(0).inputText().startsWith("Method: PUT |"));
  }

  @Test
  @DisplayName("path-level fields are never treated as methods, whatever their shape")
  void pathLevelFieldsSkipped() {
    JsonNode root =
        yaml(
            """
            paths:
              /items:
                summary:
                  description: A mapping under summary that looks like an operation
                description:
                  description: A mapping under description that looks like an operation
                parameters:
                  description: A mapping under parameters that looks like an operation
                servers:
                  description: A mapping under servers that looks like an operation
                $ref:
                  description: A mapping under ref that looks like an operation too
                x-custom-method:
                  description: Vendor keys holding mappings are mined like any method
            """);

    List<DatasetRecord> records = extractor.extract(root, "items.yaml");

    assertEquals(1, records.size());
    assertEquals(
        "Method: X-CUSTOM-METHOD | Path: /items | Summary:  | Tags: ", records.get(0).inputText());
  }

  @Test
  @DisplayName("odd shapes anywhere in paths are ignored")
  void oddShapes() {
    JsonNode root =
        yaml(
            """
            paths:
              /a: just a string
              /b:
                - get
              /c:
                get: not a mapping
                delete: ~
                patch:
                  summary: [not, a, string]
                  description: Patches the resource with a partial representation of fields
                  tags: a single string instead of a list
            """);

    List<DatasetRecord> records = extractor.extract(root, "odd.yaml");

    assertEquals(1, records.size());
    assertEquals("Method: PATCH | Path: /c | Summary:  | Tags: ", records.get(0).inputText());
  }

  @Test
  @DisplayName("missing or malformed paths yield nothing")
  void noPaths() {
    assertTrue(extractor.extract(yaml("openapi: 3.0.0"), "a.yaml").isEmpty());
    assertTrue(extractor.extract(yaml("paths: [1, 2]"), "a.yaml").isEmpty());
    assertTrue(extractor.extract(yaml("- paths"), "a.yaml").isEmpty());
    assertTrue(extractor.extract(yaml("paths: ~"), "a.yaml").isEmpty());
  }

  @Test
  @DisplayName("tags are comma joined and the description is cleaned")
  void tagsAndCleaning() {
    JsonNode root =
        yaml(
            """
            paths:
              /orders/{id}:
                delete:
                  summary: Cancel order
                  description: "<p>Cancels the order\\nidentified by <code>id</code> immediately.</p>"
                  tags: [orders, admin, 2]
            """);

    DatasetRecord record = extractor.extract(root, "orders.yaml").get(0);

    assertEquals(
        "Method: DELETE | Path: /orders/{id} | Summary: Cancel order | Tags: orders, admin, 2",
        record.inputText());
    assertEquals("Cancels the order identified by id immediately.", record.targetText());
  }

  @Test
  @DisplayName("aliased descriptions and operations are mined like inline ones")
  void aliasedOperations() {
    JsonNode root =
        yaml(
            """
            x-shared:
              desc: &longdesc Returns a list of users available in the system for pagination
              op: &op
                summary: Remove user
                description: Deletes the user identified by the id path parameter.
            paths:
              /users:
                get:
                  summary: Get users
                  description: *longdesc
                delete: *op
            """);

    List<DatasetRecord> records = extractor.extract(root, "anchors.yaml");

    assertEquals(2, records.size());
    assertEquals(
        "Returns a list of users available in the system for pagination",
        records.get(0).targetText());
    assertEquals(
        "Method: DELETE | Path: /users | Summary: Remove user | Tags: ", records.get(1).inputText());
  }
}
