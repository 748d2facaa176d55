package io.statebridge.api;

import io.statebridge.adapter.kafka.KafkaStateEventSource;
import io.statebridge.adapter.kafka.KafkaTopicPublisher;
import io.statebridge.application.dispatch.EventDispatcher;
import io.statebridge.application.dispatch.TopicRouter;
import io.statebridge.application.pipeline.StateForwardingUseCase;
import io.statebridge.application.pipeline.StateForwardingUseCase.ForwardingReport;
import io.statebridge.application.port.MetricsPort;
import io.statebridge.application.port.StateEventSource;
import io.statebridge.application.port.TopicPublisher;
import io.statebridge.config.BridgeConfig;
import io.statebridge.config.BrokerSettings;
import io.statebridge.config.IoMode;
import io.statebridge.config.SourceSettings;
import io.statebridge.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.statebridge.infrastructure.serialization.JsonStateSerializer;
import io.statebridge.infrastructure.source.JsonLinesStateEventSource;
import io.statebridge.logging.LoggingConfigurator;
import io.statebridge.validation.Numbers;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the bridge: reads state-change events and forwards them to the configured topics.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String SOURCE = "source";
  private static final String INPUT = "input";
  private static final String WORKERS = "workers";
  private static final Set<String> KEYS = Set.of(ConfigCliSupport.CONFIG, SOURCE, INPUT, WORKERS);
  private static final long SHUTDOWN_WAIT_MILLIS = TimeUnit.SECONDS.toMillis(30);
  private static final String SUMMARY_USAGE =
      "usage: run config=PATH [source=FILE|KAFKA] [input=PATH|-|TOPIC] [workers=N] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      statebridge run

      Usage:
        run config=PATH [options]

      Options:
        source=FILE|KAFKA               Override the configured event source mode
        input=PATH|-|TOPIC              JSON-lines file ("-" for stdin) or state-bus topic
        workers=N                       Dispatch worker threads (1..256)
        metricsExporter=otlp|none       OpenTelemetry metrics exporter (default otlp)
        otelEndpoint=URL                OTLP gRPC endpoint (default http://localhost:4317)
        otelResourceAttributes=K=V,...  Extra OpenTelemetry resource attributes
        --verbose                       Enable DEBUG logging for the bridge
        --help                          Show this message

      FILE sources stop at end of input. KAFKA sources run until the process is interrupted;
      shutdown drains the dispatch lanes and flushes the producer.
      """;

  private RunCli() {}

  static ExitCode run(String[] args) {
    return run(args, KafkaTopicPublisher::new);
  }

  static ExitCode run(String[] args, Function<BrokerSettings, TopicPublisher> publisherFactory) {
    Objects.requireNonNull(publisherFactory, "publisherFactory");
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run");
    }

    Map<String, String> kv;
    IoMode modeOverride;
    Integer workersOverride;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
      TelemetryConfigurator.configureMetrics(kv);
      ConfigCliSupport.rejectUnknownKeys(kv, KEYS);
      if (!kv.containsKey(ConfigCliSupport.CONFIG)) {
        throw new IllegalArgumentException("config=PATH is required");
      }
      modeOverride = kv.containsKey(SOURCE) ? IoMode.fromString(kv.get(SOURCE)) : null;
      workersOverride = kv.containsKey(WORKERS) ? parseWorkers(kv.get(WORKERS)) : null;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigCliSupport.Loaded loaded = ConfigCliSupport.load(kv.get(ConfigCliSupport.CONFIG), log);
    if (!loaded.ok()) {
      return loaded.failure();
    }
    BridgeConfig config;
    try {
      SourceSettings source = loaded.config().source().withOverrides(modeOverride, kv.get(INPUT));
      config = loaded.config().with(
          source, workersOverride == null ? loaded.config().workers() : workersOverride);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid source override: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    return forward(config, publisherFactory);
  }

  private static ExitCode forward(BridgeConfig config, Function<BrokerSettings, TopicPublisher> publisherFactory) {
    OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
    Thread shutdownHook = null;
    try {
      TopicRouter router = TopicRouter.resolve(config.topics(), config.globalFilter());
      StateEventSource source = createSource(config, metrics);
      TopicPublisher publisher;
      try {
        publisher = publisherFactory.apply(config.broker());
      } catch (RuntimeException ex) {
        closeAfterFailedStartup(source);
        throw ex;
      }
      EventDispatcher dispatcher = new EventDispatcher(router, new JsonStateSerializer(), publisher, metrics);
      StateForwardingUseCase useCase =
          new StateForwardingUseCase(source, dispatcher, publisher, metrics, config.workers());
      shutdownHook = new Thread(() -> awaitStop(useCase), "statebridge-shutdown");
      Runtime.getRuntime().addShutdownHook(shutdownHook);

      log.info("Starting bridge for {} topic(s) via {}", router.size(), config.broker());
      ForwardingReport report = useCase.run();
      log.info("Bridge stopped after {} events", report.received());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Bridge I/O failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Bridge configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Bridge interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in bridge", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in bridge", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      removeShutdownHook(shutdownHook);
      metrics.forceFlush();
      metrics.close();
    }
  }

  private static StateEventSource createSource(BridgeConfig config, MetricsPort metrics) {
    SourceSettings source = config.source();
    if (source.mode() == IoMode.KAFKA) {
      return new KafkaStateEventSource(config.broker(), source.topic(), source.groupId(), metrics);
    }
    return JsonLinesStateEventSource.forLocation(source.path(), metrics);
  }

  private static void closeAfterFailedStartup(StateEventSource source) {
    try {
      source.close();
    } catch (Exception closeFailure) {
      log.warn("Failed to close event source after startup failure", closeFailure);
    }
  }

  private static int parseWorkers(String raw) {
    try {
      return (int) Numbers.requireRange(WORKERS, Long.parseLong(raw.trim()), 1, 256);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("workers must be an integer (was " + raw + ")", ex);
    }
  }

  private static void awaitStop(StateForwardingUseCase useCase) {
    log.info("Shutdown requested; draining dispatch lanes");
    useCase.stop();
    long deadline = System.currentTimeMillis() + SHUTDOWN_WAIT_MILLIS;
    while (useCase.isRunning() && System.currentTimeMillis() < deadline) {
      try {
        Thread.sleep(50L);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  private static void removeShutdownHook(Thread hook) {
    if (hook == null) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; keeping shutdown hook", ex);
    }
  }
}
