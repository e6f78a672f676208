/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.common.setting;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads {@link Settings} from a flat JSON object, e.g. {@code {"lazyframe.batch_size": 500}}.
 */
public class SettingsLoader {

  /** Classpath resource consulted by {@link #loadDefault()}. */
  public static final String DEFAULT_RESOURCE = "lazyframe.json";

  private static final Logger LOG = LogManager.getLogger();

  private final ObjectMapper objectMapper;

  public SettingsLoader() {
    this.objectMapper = new ObjectMapper();
    this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public Settings load(InputStream inputStream) {
    try {
      Map<String, Object> values = objectMapper.readValue(inputStream, new TypeReference<>() {});
      LOG.debug("Loaded {} setting(s)", values.size());
      return new Settings(values);
    } catch (IOException e) {
      LOG.error("Settings document is malformed.");
      throw new IllegalArgumentException("Malformed settings json: " + e.getMessage(), e);
    }
  }

  /**
   * Loads {@value #DEFAULT_RESOURCE} from the classpath, or the defaults when the resource does
   * not exist.
   */
  public Settings loadDefault() {
    InputStream inputStream =
        SettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
    if (inputStream == null) {
      LOG.debug("No {} on the classpath, using default settings", DEFAULT_RESOURCE);
      return Settings.defaults();
    }
    try (InputStream in = inputStream) {
      return load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, e);
    }
  }
}
