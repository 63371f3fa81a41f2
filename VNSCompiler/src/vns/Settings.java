package vns;

import java.io.IOException;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.auto.value.AutoValue;
import com.google.common.io.Resources;
import com.google.common.primitives.Ints;

// Engine-wide settings. load() reads vns.properties from the classpath (vns.debug,
// vns.maxRewriteDepth, vns.layout.*); missing keys keep their defaults.
@AutoValue
public abstract class Settings {
  private static final Logger log = LogManager.getLogger(Settings.class);

  public static final String RESOURCE = "vns.properties";

  public static final int DEFAULT_MAX_REWRITE_DEPTH = 8;

  // When set, the processor table is checked for completeness at startup and script errors are
  // fatal instead of ignored.
  public abstract boolean debugMode();

  public abstract int maxRewriteDepth();

  public abstract Layout layout();

  public abstract Builder toBuilder();

  public static Settings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_Settings.Builder()
        .setDebugMode(false)
        .setMaxRewriteDepth(DEFAULT_MAX_REWRITE_DEPTH)
        .setLayout(Layout.defaults());
  }

  public static Settings load() throws IOException {
    URL url = Settings.class.getClassLoader().getResource(RESOURCE);
    if (url == null) {
      log.debug("No {} on the classpath, using defaults", RESOURCE);
      return defaults();
    }

    Properties properties = new Properties();
    try (Reader reader = Resources.asCharSource(url, StandardCharsets.UTF_8).openStream()) {
      properties.load(reader);
    }
    Settings settings = fromProperties(properties);
    log.debug("Loaded {} from {}", settings, url);
    return settings;
  }

  public static Settings fromProperties(Properties properties) {
    Settings defaults = defaults();
    Layout layout = defaults.layout();

    return builder()
        .setDebugMode(
            Boolean.parseBoolean(
                properties.getProperty("vns.debug", Boolean.toString(defaults.debugMode()))))
        .setMaxRewriteDepth(
            intProperty(properties, "vns.maxRewriteDepth", defaults.maxRewriteDepth()))
        .setLayout(
            Layout.builder()
                .setSceneX(intProperty(properties, "vns.layout.sceneX", layout.sceneX()))
                .setSceneY(intProperty(properties, "vns.layout.sceneY", layout.sceneY()))
                .setSceneWidth(
                    intProperty(properties, "vns.layout.sceneWidth", layout.sceneWidth()))
                .setSceneHeight(
                    intProperty(properties, "vns.layout.sceneHeight", layout.sceneHeight()))
                .setScreenCenterX(
                    intProperty(properties, "vns.layout.screenCenterX", layout.screenCenterX()))
                .setMargin(intProperty(properties, "vns.layout.margin", layout.margin()))
                .build())
        .build();
  }

  private static int intProperty(Properties properties, String key, int defaultValue) {
    String raw = properties.getProperty(key);
    if (raw == null) return defaultValue;

    Integer value = Ints.tryParse(raw.trim());
    if (value == null) {
      throw new IllegalArgumentException(String.format("%s is not an integer: '%s'", key, raw));
    }
    return value;
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setDebugMode(boolean debugMode);

    public abstract Builder setMaxRewriteDepth(int maxRewriteDepth);

    public abstract Builder setLayout(Layout layout);

    abstract Settings autoBuild();

    public final Settings build() {
      Settings settings = autoBuild();
      if (settings.maxRewriteDepth() < 0) {
        throw new IllegalArgumentException(
            "maxRewriteDepth must not be negative: " + settings.maxRewriteDepth());
      }
      return settings;
    }
  }
}
