package com.gentoro.specminer;

import com.gentoro.specminer.dataset.SplitRatios;
import com.gentoro.specminer.document.DocumentParser;
import com.gentoro.specminer.exception.ConfigException;
import com.gentoro.specminer.extraction.ExtractorCapability;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Typed view of the {@code miner.*} configuration keys.
 *
 * @param rootDir directory holding the corpus directories
 * @param corpora allowlisted corpus directory names, in visiting order
 * @param extractors enabled record families
 * @param splitSeed seed of the train/val/test shuffle
 * @param splitRatios train/val/test shares
 * @param outputDir where split files and the summary are written
 * @param parallelism number of worker threads parsing files; 1 means sequential
 * @param maxCodePoints largest document, in characters, the YAML reader accepts
 */
public record MinerSettings(
    Path rootDir,
    List<String> corpora,
    Set<ExtractorCapability> extractors,
    long splitSeed,
    SplitRatios splitRatios,
    Path outputDir,
    int parallelism,
    int maxCodePoints) {

  public static final String DEFAULT_ROOT_DIR = "open_api_specs";
  public static final List<String> DEFAULT_CORPORA =
      List.of("broken", "business", "deployed", "public", "specs-3.0");
  public static final long DEFAULT_SEED = 42L;

  public MinerSettings {
    corpora = List.copyOf(corpora);
    extractors =
        Collections.unmodifiableSet(
            extractors.isEmpty()
                ? EnumSet.noneOf(ExtractorCapability.class)
                : EnumSet.copyOf(extractors));
    if (extractors.isEmpty()) {
      throw new ConfigException("At least one extractor must be enabled");
    }
    if (parallelism < 1) {
      throw new ConfigException("miner.parallelism must be >= 1, got " + parallelism);
    }
    if (maxCodePoints < 1) {
      throw new ConfigException("miner.parser.max-code-points must be >= 1, got " + maxCodePoints);
    }
  }

  public static MinerSettings fromConfiguration(Configuration cfg) {
    try {
      Path rootDir = Path.of(cfg.getString("miner.root-dir", DEFAULT_ROOT_DIR));
      List<String> corpora = stringList(cfg, "miner.corpora", DEFAULT_CORPORA);

      List<String> extractorNames =
          stringList(
              cfg,
              "miner.extractors",
              ExtractorCapability.all().stream().map(ExtractorCapability::configName).toList());
      Set<ExtractorCapability> extractors = EnumSet.noneOf(ExtractorCapability.class);
      for (String name : extractorNames) {
        extractors.add(ExtractorCapability.fromName(name));
      }

      SplitRatios ratios =
          new SplitRatios(
              cfg.getDouble("miner.split.ratios.train", SplitRatios.DEFAULT.train()),
              cfg.getDouble("miner.split.ratios.val", SplitRatios.DEFAULT.val()),
              cfg.getDouble("miner.split.ratios.test", SplitRatios.DEFAULT.test()));

      return new MinerSettings(
          rootDir,
          corpora,
          extractors,
          cfg.getLong("miner.split.seed", DEFAULT_SEED),
          ratios,
          Path.of(cfg.getString("miner.output-dir", ".")),
          cfg.getInt("miner.parallelism", 1),
          cfg.getInt("miner.parser.max-code-points", DocumentParser.DEFAULT_MAX_CODE_POINTS));
    } catch (ConversionException e) {
      throw new ConfigException("Invalid miner configuration: " + e.getMessage(), e);
    }
  }

  /**
   * Reads a YAML list, or a single comma separated string, as a list of trimmed non-blank values.
   */
  static List<String> stringList(Configuration cfg, String key, List<String> defaults) {
    if (!cfg.containsKey(key)) {
      return defaults;
    }
    List<String> result = new ArrayList<>();
    for (String raw : cfg.getList(String.class, key, defaults)) {
      for (String part : raw.split(",")) {
        if (!part.isBlank()) {
          result.add(part.trim());
        }
      }
    }
    return result;
  }
}
