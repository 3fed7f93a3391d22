/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.mycat.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads {@link MyCatOptions} from JSON.
 *
 * <p>The classpath resource {@value #OPTIONS_JSON_PATH} is optional; when it is missing the
 * defaults apply. A present but malformed file is a configuration error, never silently ignored.
 */
@Slf4j
@UtilityClass
public class MyCatOptionsLoader {

  public static final String OPTIONS_JSON_PATH = "/mycat.json";

  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  public static MyCatOptions loadDefault() {
    try (final InputStream in = MyCatOptionsLoader.class.getResourceAsStream(OPTIONS_JSON_PATH)) {
      if (Objects.isNull(in)) {
        log.debug("No {} on the classpath, using default options.", OPTIONS_JSON_PATH);
        return MyCatOptions.defaults();
      }
      return load(in);
    } catch (final IOException e) {
      log.error("Error reading {}: {}", OPTIONS_JSON_PATH, e.getMessage(), e);
      throw new MyCatConfigurationException("Could not read " + OPTIONS_JSON_PATH, e);
    }
  }

  public static MyCatOptions load(final InputStream in) {
    Objects.requireNonNull(in, "Options stream cannot be null");
    final MyCatOptions options;
    try {
      options = MAPPER.readValue(in, MyCatOptions.class);
    } catch (final JsonProcessingException e) {
      log.error("Error parsing provider options: {}", e.getOriginalMessage(), e);
      throw new MyCatConfigurationException(
          "Invalid provider options: " + e.getOriginalMessage(), e);
    } catch (final IOException e) {
      throw new MyCatConfigurationException("Could not read provider options", e);
    }
    if (Objects.isNull(options)) {
      throw new MyCatConfigurationException("Provider options must be a JSON object");
    }
    log.info("Loaded provider options {}", options);
    return options.validate();
  }
}
