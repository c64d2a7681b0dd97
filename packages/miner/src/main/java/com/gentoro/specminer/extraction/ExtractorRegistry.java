package com.gentoro.specminer.extraction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;

/** Builds the extractor chain for a set of enabled capabilities. */
public final class ExtractorRegistry {

  private ExtractorRegistry() {}

  /**
   * Extractors for {@code capabilities}, always in operations, examples, schemas order so the
   * records of one file come out in a stable order.
   */
  public static List<RecordExtractor> forCapabilities(Collection<ExtractorCapability> capabilities) {
    EnumSet<ExtractorCapability> enabled =
        capabilities.isEmpty()
            ? EnumSet.noneOf(ExtractorCapability.class)
            : EnumSet.copyOf(capabilities);
    List<RecordExtractor> extractors = new ArrayList<>();
    for (ExtractorCapability capability : enabled) {
      extractors.add(create(capability));
    }
    return extractors;
  }

  public static RecordExtractor create(ExtractorCapability capability) {
    return switch (capability) {
      case OPERATIONS -> new OperationExtractor();
      case EXAMPLES -> new ExampleExtractor();
      case SCHEMAS -> new SchemaExtractor();
    };
  }
}
