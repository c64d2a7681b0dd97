package com.gentoro.specminer.dataset;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.specminer.exception.EmptyCorpusException;
import com.gentoro.specminer.exception.SpecMinerErrorCode;
import com.gentoro.specminer.model.DatasetRecord;
import com.gentoro.specminer.model.MinedDataset;
import com.gentoro.specminer.model.RecordType;
import com.gentoro.specminer.pipeline.ExtractionResult;
import com.gentoro.specminer.pipeline.FileFailure;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class DatasetAssemblerTest {

  private final DatasetAssembler assembler =
      new DatasetAssembler(new Splitter(42, SplitRatios.DEFAULT));

  @Test
  void deduplicatesBeforeSplitting() {
    List<DatasetRecord> records =
        IntStream.range(0, 12)
            .mapToObj(
                i ->
                    new DatasetRecord(
                        "f.yaml",
                        RecordType.OPERATION_DESCRIPTION,
                        "input " + (i % 10),
                        "target " + i))
            .toList();

    MinedDataset dataset =
        assembler.assemble(new ExtractionResult(records, 3, 0, 0, 0, List.of()));

    assertEquals(10, dataset.records().size());
    assertEquals(10, dataset.split().size());
    assertEquals(10, dataset.summary().totalExamples());
    assertEquals(8, dataset.summary().trainSize());
    assertEquals("target 0", dataset.records().get(0).targetText());
  }

  @Test
  void emptyCorpusIsReportedWithCounts() {
    ExtractionResult result =
        new ExtractionResult(
            List.of(),
            4,
            1,
            1,
            2,
            List.of(
                new FileFailure("broken/a.yaml", FileFailure.Kind.PARSE, "bad"),
                new FileFailure("broken/b.yaml", FileFailure.Kind.EXTRACTION, "boom")));

    EmptyCorpusException e =
        assertThrows(EmptyCorpusException.class, () -> assembler.assemble(result));

    assertEquals(SpecMinerErrorCode.EMPTY_CORPUS, e.getCode());
    assertEquals(4, e.getContext().get("processedFiles"));
    assertEquals(1, e.getContext().get("parseFailures"));
    assertEquals(1, e.getContext().get("skippedFiles"));
  }
}
