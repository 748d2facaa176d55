package io.statebridge.api;

import io.statebridge.application.dispatch.TopicRouter;
import io.statebridge.domain.entity.EntityId;
import io.statebridge.logging.LoggingConfigurator;
import io.statebridge.validation.Strings;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dry-runs the topic filters for one or more entity ids without touching the broker.
 *
 * @since 0.1.0
 */
public final class EvaluateCli {
  private static final Logger log = LoggerFactory.getLogger(EvaluateCli.class);
  private static final String ENTITY = "entity";
  private static final String SUMMARY_USAGE = "usage: evaluate config=PATH entity=ID[,ID...] [entity=ID ...]";
  private static final String HELP_TEXT = """
      statebridge evaluate

      Usage:
        evaluate config=PATH entity=ID[,ID...] [entity=ID ...]

      Prints, for every entity and topic, whether a state change of that entity would be
      published to the topic. No broker connection is made.
      """;

  private EvaluateCli() {}

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
    Set<String> entities = new LinkedHashSet<>();
    try {
      Map<String, List<String>> kv = CliArgsParser.toMultiMap(input.keyValueArgs());
      ConfigCliSupport.rejectUnknownKeys(kv, Set.of(ConfigCliSupport.CONFIG, ENTITY));
      List<String> configValues = kv.get(ConfigCliSupport.CONFIG);
      if (configValues == null) {
        throw new IllegalArgumentException("config=PATH is required");
      }
      configPath = configValues.get(configValues.size() - 1);
      for (String value : kv.getOrDefault(ENTITY, List.of())) {
        for (String token : value.split(",")) {
          if (!token.isBlank()) {
            entities.add(Strings.requireNonBlank(ENTITY, token));
          }
        }
      }
      if (entities.isEmpty()) {
        throw new IllegalArgumentException("at least one entity=ID is required");
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
    TopicRouter router = TopicRouter.resolve(loaded.config().topics(), loaded.config().globalFilter());
    for (String entity : entities) {
      CliPrinter.printDecisions(entity, router.routes(), router.decide(EntityId.of(entity)));
    }
    return ExitCode.SUCCESS;
  }
}
