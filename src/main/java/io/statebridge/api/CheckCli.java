package io.statebridge.api;

import io.statebridge.application.dispatch.TopicRouter;
import io.statebridge.config.BridgeConfig;
import io.statebridge.config.IoMode;
import io.statebridge.logging.LoggingConfigurator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a configuration file and prints every topic's effective filter without touching the
 * broker.
 *
 * @since 0.1.0
 */
public final class CheckCli {
  private static final Logger log = LoggerFactory.getLogger(CheckCli.class);
  private static final String SUMMARY_USAGE = "usage: check config=PATH";
  private static final String HELP_TEXT = """
      statebridge check

      Usage:
        check config=PATH

      Loads and validates the configuration, then prints each topic with its effective
      filter and where that filter comes from (topic, global or match-all).
      No broker connection is made.
      """;

  private CheckCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String configPath;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      ConfigCliSupport.rejectUnknownKeys(kv, Set.of(ConfigCliSupport.CONFIG));
      configPath = kv.get(ConfigCliSupport.CONFIG);
      if (configPath == null) {
        throw new IllegalArgumentException("config=PATH is required");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigCliSupport.Loaded loaded = ConfigCliSupport.load(configPath, log);
    if (!loaded.ok()) {
      return loaded.failure();
    }
    printReport(configPath, loaded.config());
    return ExitCode.SUCCESS;
  }

  private static void printReport(String configPath, BridgeConfig config) {
    TopicRouter router = TopicRouter.resolve(config.topics(), config.globalFilter());
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("Broker", config.broker().host() + ':' + config.broker().port()
        + " (" + config.broker().securityProtocol() + ")");
    fields.put("Source", config.source().mode() == IoMode.KAFKA
        ? "KAFKA " + config.source().topic() + " (group " + config.source().groupId() + ")"
        : "FILE " + config.source().path());
    fields.put("Workers", config.workers());
    CliPrinter.printConfigHeader(configPath, fields, config.globalFilter());
    CliPrinter.printRoutes(router.routes());
  }
}
