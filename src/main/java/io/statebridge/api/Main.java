package io.statebridge.api;

import io.statebridge.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher that routes to the bridge subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: statebridge <run|check|evaluate> [options]";
  private static final String HELP_TEXT = """
      statebridge: state bus to Kafka topic dispatcher

      Usage:
        statebridge <command> [options]

      Commands:
        run        Forward state-change events to the configured topics (run --help for details)
        check      Validate a configuration and print each topic's effective filter
        evaluate   Show which topics would receive a given entity

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (!input.unknownFlags().isEmpty()) {
      log.error("Unknown flag(s): {}", input.unknownFlags());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = withoutCommand(args, remainder[0]);

    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "check" -> CheckCli.run(delegateArgs);
      case "evaluate" -> EvaluateCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutCommand(String[] args, String command) {
    List<String> delegate = new ArrayList<>(args.length);
    boolean skipped = false;
    for (String arg : args) {
      if (!skipped && arg != null && arg.trim().equals(command)) {
        skipped = true;
        continue;
      }
      delegate.add(arg);
    }
    return delegate.toArray(String[]::new);
  }
}
