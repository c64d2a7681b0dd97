package com.gentoro.specminer;

import com.gentoro.specminer.corpus.FileCollector;
import com.gentoro.specminer.dataset.DatasetAssembler;
import com.gentoro.specminer.dataset.DatasetWriter;
import com.gentoro.specminer.dataset.Splitter;
import com.gentoro.specminer.document.DocumentParser;
import com.gentoro.specminer.extraction.ExtractorRegistry;
import com.gentoro.specminer.model.MinedDataset;
import com.gentoro.specminer.pipeline.ExtractionPipeline;
import com.gentoro.specminer.pipeline.ExtractionResult;
import java.util.Arrays;
import org.apache.commons.configuration2.Configuration;

/**
 * Wires configuration, the extraction pipeline and dataset assembly into one run.
 *
 * <p>In {@code extract} mode the dataset is written to the output directory; in {@code dry-run}
 * mode it is only built and reported. Nothing is written when the corpus yields no records.
 */
public class SpecMiner {

  private static final org.slf4j.Logger log =
      com.gentoro.specminer.logging.LoggingService.getLogger(SpecMiner.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private MinerSettings settings;

  public SpecMiner(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    applyOverrides(configuration(), startupParameters);
    com.gentoro.specminer.logging.LoggingService.applyConfiguration(configuration());
    this.settings = MinerSettings.fromConfiguration(configuration());
    log.info(
        "Mining {} under {} with extractors {}",
        settings.corpora(),
        settings.rootDir().toAbsolutePath(),
        settings.extractors());
  }

  /** Command line values win over the configuration file. */
  static void applyOverrides(Configuration cfg, StartupParameters parameters) {
    parameters
        .getOptionalParameter("root-dir")
        .ifPresent(v -> cfg.setProperty("miner.root-dir", v));
    parameters
        .getOptionalParameter("output-dir")
        .ifPresent(v -> cfg.setProperty("miner.output-dir", v));
    parameters
        .getOptionalParameter("extractors")
        .ifPresent(v -> cfg.setProperty("miner.extractors", Arrays.asList(v.split(","))));
  }

  public MinedDataset run() {
    ExtractionPipeline pipeline =
        new ExtractionPipeline(
            new FileCollector(settings.rootDir(), settings.corpora()),
            new DocumentParser(settings.maxCodePoints()),
            ExtractorRegistry.forCapabilities(settings.extractors()),
            settings.parallelism());
    ExtractionResult result = pipeline.run();

    MinedDataset dataset =
        new DatasetAssembler(new Splitter(settings.splitSeed(), settings.splitRatios()))
            .assemble(result);

    if (isDryRun()) {
      log.info("Dry run: nothing written");
    } else {
      new DatasetWriter(settings.outputDir()).write(dataset);
    }
    return dataset;
  }

  public boolean isDryRun() {
    return "dry-run".equals(startupParameters.mode());
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new IllegalStateException("SpecMiner not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public MinerSettings settings() {
    if (settings == null) {
      throw new IllegalStateException("SpecMiner not initialized. Call initialize() first.");
    }
    return settings;
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }
}
