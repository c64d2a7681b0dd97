package com.gentoro.specminer.extraction;

import com.gentoro.specminer.exception.ConfigException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** Record families a run can mine. Selected through the {@code miner.extractors} setting. */
public enum ExtractorCapability {
  OPERATIONS("operations"),
  EXAMPLES("examples"),
  SCHEMAS("schemas");

  private final String configName;

  ExtractorCapability(String configName) {
    this.configName = configName;
  }

  public String configName() {
    return configName;
  }

  public static ExtractorCapability fromName(String name) {
    String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    for (ExtractorCapability capability : values()) {
      if (capability.configName.equals(normalized)) {
        return capability;
      }
    }
    throw new ConfigException(
        "Unknown extractor '%s'; expected one of %s"
            .formatted(
                name,
                Arrays.stream(values())
                    .map(ExtractorCapability::configName)
                    .collect(Collectors.joining(", "))));
  }

  public static Set<ExtractorCapability> all() {
    return EnumSet.allOf(ExtractorCapability.class);
  }
}
