/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.pipelineplanner.common.setting;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Settings that shape plan translation. Read from a JSON document such as:
 *
 * <pre>
 * {
 *   "setOperationsEnabled": true,
 *   "maxPlanDepth": 1000
 * }
 * </pre>
 *
 * <p>Missing properties keep their defaults, unknown ones are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
@ToString
@EqualsAndHashCode
public class PlannerSettings {

  private static final Logger LOG = LogManager.getLogger();

  public static final String DEFAULT_RESOURCE = "planner-settings.json";

  public static final int DEFAULT_MAX_PLAN_DEPTH = 1000;

  /** Translate Substrait set relations (union, intersect, except) as pipeline breaks. */
  @JsonProperty
  private boolean setOperationsEnabled = true;

  /** Deepest relation nesting accepted before the plan is rejected as malformed. */
  @JsonProperty
  private int maxPlanDepth = DEFAULT_MAX_PLAN_DEPTH;

  public static PlannerSettings defaults() {
    return new PlannerSettings();
  }

  /**
   * Reads settings from a JSON input stream.
   *
   * @param inputStream inputstream.
   * @return parsed settings.
   */
  public static PlannerSettings load(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    try {
      PlannerSettings settings = objectMapper.readValue(inputStream, PlannerSettings.class);
      settings.validate();
      return settings;
    } catch (IOException e) {
      LOG.error("Planner settings are malformed. Verify the settings document.");
      throw new IllegalArgumentException("Malformed planner settings json: " + e.getMessage(), e);
    }
  }

  /** Reads settings from a JSON file. */
  public static PlannerSettings load(Path path) {
    try (InputStream inputStream = Files.newInputStream(path)) {
      return load(inputStream);
    } catch (IOException e) {
      throw new IllegalArgumentException("Cannot read planner settings from " + path, e);
    }
  }

  /**
   * Reads {@value #DEFAULT_RESOURCE} from the classpath, falling back to {@link #defaults()} when
   * the resource is absent.
   */
  public static PlannerSettings fromClasspath(ClassLoader classLoader) {
    try (InputStream inputStream = classLoader.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (inputStream == null) {
        LOG.debug("No {} on the classpath, using default planner settings", DEFAULT_RESOURCE);
        return defaults();
      }
      return load(inputStream);
    } catch (IOException e) {
      throw new IllegalArgumentException("Cannot read " + DEFAULT_RESOURCE, e);
    }
  }

  private void validate() {
    if (maxPlanDepth < 1) {
      throw new IllegalArgumentException("maxPlanDepth must be positive, got " + maxPlanDepth);
    }
  }
}
