package io.statebridge.api;

import io.statebridge.application.dispatch.TopicDecision;
import io.statebridge.application.dispatch.TopicRoute;
import io.statebridge.domain.filter.FilterSpecification;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Console renderer for command output: usage text, the {@code check} configuration report and
 * {@code evaluate} routing decisions.
 *
 * <p>Writes to the native stdout descriptor so reports stay separate from log output, which goes to
 * stderr.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final String NONE = "<none>";
  private static volatile PrintWriter override;

  private CliPrinter() {}

  static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints the aligned header block of the {@code check} report.
   *
   * @param configPath configuration file that was validated
   * @param fields label/value pairs in display order
   * @param globalFilter root-level filter, if configured
   */
  static void printConfigHeader(
      String configPath, Map<String, Object> fields, Optional<FilterSpecification> globalFilter) {
    PrintWriter writer = writer();
    writer.println("Configuration OK: " + configPath);
    fields.forEach((label, value) -> writer.println(field(label, value)));
    writer.println(field("Global filter", globalFilter.map(ConfigCliSupport::describe).orElse(NONE)));
  }

  /**
   * Prints one row per topic with the origin and rules of its effective filter.
   *
   * @param routes resolved routes in configuration order
   */
  static void printRoutes(List<TopicRoute> routes) {
    PrintWriter writer = writer();
    writer.println(" Topics (" + routes.size() + "):");
    for (TopicRoute route : routes) {
      writer.println(routeRow(route));
    }
  }

  /**
   * Prints the publish/skip decision of every topic for one entity.
   *
   * @param entity entity id as given on the command line
   * @param routes resolved routes in configuration order
   * @param decisions decisions in the same order as {@code routes}
   * @throws IllegalArgumentException if the two lists do not describe the same topics
   */
  static void printDecisions(String entity, List<TopicRoute> routes, List<TopicDecision> decisions) {
    if (routes.size() != decisions.size()) {
      throw new IllegalArgumentException(
          "expected " + routes.size() + " decisions for " + entity + " but got " + decisions.size());
    }
    PrintWriter writer = writer();
    writer.println(entity + ":");
    for (int i = 0; i < routes.size(); i++) {
      writer.println(decisionRow(routes.get(i), decisions.get(i)));
    }
  }

  static String field(String label, Object value) {
    return String.format(" %-15s: %s", label, value == null ? NONE : value);
  }

  static String routeRow(TopicRoute route) {
    return "  " + route.topic() + " [" + route.origin() + "] " + ConfigCliSupport.describe(route.specification());
  }

  static String decisionRow(TopicRoute route, TopicDecision decision) {
    if (!route.topic().equals(decision.topic())) {
      throw new IllegalArgumentException(
          "decision for " + decision.topic() + " does not belong to route " + route.topic());
    }
    return "  " + decision.topic() + " -> " + (decision.matched() ? "PUBLISH" : "SKIP")
        + " (" + route.origin() + " filter)";
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
