package com.gentoro.specminer;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.util.List;

/** Locates the fixture corpus under {@code src/test/resources/corpus}. */
public final class TestCorpus {

  public static final List<String> CORPORA = List.of("broken", "business", "deployed", "public");

  private TestCorpus() {}

  public static Path root() {
    URL url = TestCorpus.class.getClassLoader().getResource("corpus");
    if (url == null) {
      throw new IllegalStateException("Fixture corpus not on the test classpath");
    }
    try {
      return Path.of(url.toURI());
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }
}
