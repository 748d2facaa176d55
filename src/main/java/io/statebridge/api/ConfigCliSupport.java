package io.statebridge.api;

import io.statebridge.config.BridgeConfig;
import io.statebridge.config.BridgeConfigLoader;
import io.statebridge.domain.filter.FilterSpecification;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Shared helpers for the commands that read the bridge configuration.
 */
final class ConfigCliSupport {
  static final String CONFIG = "config";

  private ConfigCliSupport() {}

  /**
   * Outcome of loading configuration for a command: either a config or the exit code to return.
   */
  record Loaded(BridgeConfig config, ExitCode failure) {
    boolean ok() {
      return failure == null;
    }
  }

  static Loaded load(String configPath, Logger log) {
    Path path = Path.of(configPath);
    try {
      return new Loaded(BridgeConfigLoader.load(path), null);
    } catch (IOException ex) {
      log.error("Unable to read configuration {}: {}", path, ex.getMessage());
      return new Loaded(null, ExitCode.IO_ERROR);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration {}: {}", path, ex.getMessage());
      return new Loaded(null, ExitCode.CONFIG_ERROR);
    }
  }

  static void rejectUnknownKeys(Map<String, ?> args, Set<String> allowed) {
    for (String key : args.keySet()) {
      if (!allowed.contains(key)) {
        throw new IllegalArgumentException("unknown argument: " + key);
      }
    }
  }

  static String describe(FilterSpecification filter) {
    if (filter.isEmpty()) {
      return "match-all";
    }
    List<String> parts = new ArrayList<>(4);
    append(parts, "exclude_domains", filter.excludeDomains());
    append(parts, "exclude_entities", filter.excludeEntities());
    append(parts, "include_domains", filter.includeDomains());
    append(parts, "include_entities", filter.includeEntities());
    return String.join(" ", parts);
  }

  private static void append(List<String> parts, String name, Set<String> values) {
    if (!values.isEmpty()) {
      parts.add(name + "=" + values);
    }
  }
}
