package io.statebridge.config;

import io.statebridge.domain.filter.FilterSpecification;
import io.statebridge.domain.filter.TopicConfiguration;
import io.statebridge.validation.Net;
import io.statebridge.validation.Numbers;
import io.statebridge.validation.Strings;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads and validates the bridge configuration from a YAML document.
 *
 * <p>The bridge reads the {@code apache_kafka} section of the root mapping; other root sections are
 * ignored. Unknown keys inside the section, a topic, a filter or the source block are errors. Any
 * validation failure raises {@link IllegalArgumentException} naming the offending path.</p>
 *
 * @since 0.1.0
 */
public final class BridgeConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(BridgeConfigLoader.class);

  /** Root key of the bridge section. */
  public static final String SECTION = "apache_kafka";

  private static final String IP_ADDRESS = "ip_address";
  private static final String PORT = "port";
  private static final String SECURITY_PROTOCOL = "security_protocol";
  private static final String USERNAME = "username";
  private static final String PASSWORD = "password";
  private static final String FILTER = "filter";
  private static final String TOPICS = "topics";
  private static final String TOPIC = "topic";
  private static final String SOURCE = "source";
  private static final String WORKERS = "workers";
  private static final String MODE = "mode";
  private static final String PATH = "path";
  private static final String GROUP_ID = "group_id";

  private static final Set<String> SECTION_KEYS =
      Set.of(IP_ADDRESS, PORT, SECURITY_PROTOCOL, USERNAME, PASSWORD, FILTER, TOPICS, SOURCE, WORKERS);
  private static final Set<String> TOPIC_KEYS = Set.of(TOPIC, FILTER);
  private static final Set<String> SOURCE_KEYS = Set.of(MODE, TOPIC, PATH, GROUP_ID);
  private static final int MAX_WORKERS = 256;

  private BridgeConfigLoader() {}

  /**
   * Loads configuration from a file.
   *
   * @param path YAML file
   * @return validated configuration
   * @throws IOException when the file is missing or unreadable
   * @throws IllegalArgumentException when the document is invalid
   */
  public static BridgeConfig load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new NoSuchFileException(path.toString(), null, "configuration file not found");
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      BridgeConfig config = parse(reader, path.toString());
      log.info("Loaded configuration from {} with {} topic(s)", path, config.topics().size());
      return config;
    }
  }

  /**
   * Parses configuration from YAML text.
   *
   * @param yaml document text
   * @return validated configuration
   * @throws IllegalArgumentException when the document is invalid
   */
  public static BridgeConfig parse(String yaml) {
    Objects.requireNonNull(yaml, "yaml");
    return parse(new StringReader(yaml), "<inline>");
  }

  private static BridgeConfig parse(Reader reader, String origin) {
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + origin, ex);
    }
    if (document == null) {
      throw new IllegalArgumentException("configuration at " + origin + " is empty");
    }
    Map<String, Object> root = YamlNodes.asMap(document, "root");
    Object sectionNode = root.get(SECTION);
    if (sectionNode == null) {
      throw new IllegalArgumentException("configuration at " + origin + " has no '" + SECTION + "' section");
    }
    Map<String, Object> section = YamlNodes.asMap(sectionNode, SECTION);
    YamlNodes.rejectUnknownKeys(section, SECTION_KEYS, SECTION);

    BrokerSettings broker = parseBroker(section);
    Optional<FilterSpecification> globalFilter = section.containsKey(FILTER)
        ? Optional.of(FilterDescriptorParser.parse(section.get(FILTER), SECTION + '.' + FILTER))
        : Optional.empty();
    List<TopicConfiguration> topics = parseTopics(section.get(TOPICS));
    SourceSettings source = parseSource(section.get(SOURCE));
    int workers = section.containsKey(WORKERS)
        ? (int) Numbers.requireRange(SECTION + '.' + WORKERS,
            YamlNodes.toLong(section.get(WORKERS), SECTION + '.' + WORKERS), 1, MAX_WORKERS)
        : BridgeConfig.defaultWorkers();
    return new BridgeConfig(broker, globalFilter, topics, source, workers);
  }

  private static BrokerSettings parseBroker(Map<String, Object> section) {
    String host = Net.validateHost(SECTION + '.' + IP_ADDRESS,
        YamlNodes.requireString(section, IP_ADDRESS, SECTION));
    int port = Numbers.requirePort(SECTION + '.' + PORT, YamlNodes.requireLong(section, PORT, SECTION));
    SecurityProtocol protocol =
        SecurityProtocol.fromString(YamlNodes.optionalString(section, SECURITY_PROTOCOL, SECTION));
    String username = YamlNodes.optionalString(section, USERNAME, SECTION);
    String password = YamlNodes.optionalString(section, PASSWORD, SECTION);
    return new BrokerSettings(host, port, protocol, username, password);
  }

  private static List<TopicConfiguration> parseTopics(Object node) {
    if (node == null) {
      throw new IllegalArgumentException(SECTION + '.' + TOPICS + " is required");
    }
    List<Object> entries = new ArrayList<>();
    if (node instanceof Map<?, ?>) {
      entries.add(node);
    } else if (node instanceof Iterable<?> iterable) {
      iterable.forEach(entries::add);
    } else {
      throw new IllegalArgumentException(SECTION + '.' + TOPICS + " must be a mapping or a list of mappings");
    }
    if (entries.isEmpty()) {
      throw new IllegalArgumentException(SECTION + '.' + TOPICS + " must not be empty");
    }

    List<TopicConfiguration> topics = new ArrayList<>(entries.size());
    Set<String> names = new LinkedHashSet<>();
    for (int i = 0; i < entries.size(); i++) {
      String context = SECTION + '.' + TOPICS + '[' + i + ']';
      Map<String, Object> entry = YamlNodes.asMap(entries.get(i), context);
      YamlNodes.rejectUnknownKeys(entry, TOPIC_KEYS, context);
      String name = Strings.sanitizeTopic(context + '.' + TOPIC, YamlNodes.requireString(entry, TOPIC, context));
      if (!names.add(name)) {
        throw new IllegalArgumentException("Duplicate topic detected: " + name);
      }
      if (entry.containsKey(FILTER)) {
        topics.add(TopicConfiguration.filtered(
            name, FilterDescriptorParser.parse(entry.get(FILTER), context + '.' + FILTER)));
      } else {
        topics.add(TopicConfiguration.inheriting(name));
      }
    }
    return topics;
  }

  private static SourceSettings parseSource(Object node) {
    if (node == null) {
      return SourceSettings.stdin();
    }
    String context = SECTION + '.' + SOURCE;
    Map<String, Object> map = YamlNodes.asMap(node, context);
    YamlNodes.rejectUnknownKeys(map, SOURCE_KEYS, context);
    String modeValue = YamlNodes.optionalString(map, MODE, context);
    IoMode mode = modeValue == null ? IoMode.FILE : IoMode.fromString(modeValue);
    if (mode == IoMode.KAFKA) {
      String topic = Strings.sanitizeTopic(context + '.' + TOPIC, YamlNodes.requireString(map, TOPIC, context));
      return new SourceSettings(
          IoMode.KAFKA, topic, null, YamlNodes.optionalString(map, GROUP_ID, context));
    }
    return new SourceSettings(IoMode.FILE, null, YamlNodes.optionalString(map, PATH, context));
  }
}
