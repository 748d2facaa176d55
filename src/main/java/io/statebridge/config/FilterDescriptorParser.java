package io.statebridge.config;

import io.statebridge.application.filter.PatternMatchers;
import io.statebridge.domain.filter.FilterSpecification;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a YAML filter mapping into a {@link FilterSpecification}.
 *
 * <p>Recognized keys: {@code include_domains}, {@code include_entities}, {@code include_entity_globs},
 * {@code exclude_domains}, {@code exclude_entities}, {@code exclude_entity_globs}. Each value is a
 * string or a list of strings. Glob keys merge into the matching entity set. Entity ids without a
 * wildcard must have the {@code <domain>.<object_id>} shape.</p>
 *
 * @since 0.1.0
 */
final class FilterDescriptorParser {
  static final String INCLUDE_DOMAINS = "include_domains";
  static final String INCLUDE_ENTITIES = "include_entities";
  static final String INCLUDE_ENTITY_GLOBS = "include_entity_globs";
  static final String EXCLUDE_DOMAINS = "exclude_domains";
  static final String EXCLUDE_ENTITIES = "exclude_entities";
  static final String EXCLUDE_ENTITY_GLOBS = "exclude_entity_globs";

  private static final Set<String> KEYS = Set.of(
      INCLUDE_DOMAINS, INCLUDE_ENTITIES, INCLUDE_ENTITY_GLOBS,
      EXCLUDE_DOMAINS, EXCLUDE_ENTITIES, EXCLUDE_ENTITY_GLOBS);

  private FilterDescriptorParser() {}

  /**
   * Parses a filter mapping.
   *
   * @param node YAML node; {@code null} yields the empty specification
   * @param context configuration path used in error messages
   * @return parsed specification
   * @throws IllegalArgumentException when the node or one of its entries is invalid
   */
  static FilterSpecification parse(Object node, String context) {
    if (node == null) {
      return FilterSpecification.empty();
    }
    Map<String, Object> map = YamlNodes.asMap(node, context);
    YamlNodes.rejectUnknownKeys(map, KEYS, context);

    FilterSpecification.Builder builder = FilterSpecification.builder()
        .includeDomains(domains(map.get(INCLUDE_DOMAINS), context + '.' + INCLUDE_DOMAINS))
        .excludeDomains(domains(map.get(EXCLUDE_DOMAINS), context + '.' + EXCLUDE_DOMAINS))
        .includeEntities(entities(map.get(INCLUDE_ENTITIES), context + '.' + INCLUDE_ENTITIES))
        .includeEntities(globs(map.get(INCLUDE_ENTITY_GLOBS), context + '.' + INCLUDE_ENTITY_GLOBS))
        .excludeEntities(entities(map.get(EXCLUDE_ENTITIES), context + '.' + EXCLUDE_ENTITIES))
        .excludeEntities(globs(map.get(EXCLUDE_ENTITY_GLOBS), context + '.' + EXCLUDE_ENTITY_GLOBS));
    return builder.build();
  }

  private static List<String> domains(Object node, String context) {
    List<String> values = YamlNodes.stringList(node, context);
    for (String value : values) {
      if (!PatternMatchers.isGlob(value) && value.indexOf('.') >= 0) {
        throw new IllegalArgumentException(context + " entry '" + value + "' is not a domain");
      }
    }
    return values;
  }

  private static List<String> entities(Object node, String context) {
    List<String> values = YamlNodes.stringList(node, context);
    for (String value : values) {
      if (!PatternMatchers.isGlob(value) && !isEntityId(value)) {
        throw new IllegalArgumentException(
            context + " entry '" + value + "' must look like <domain>.<object_id>");
      }
    }
    return values;
  }

  private static List<String> globs(Object node, String context) {
    return new ArrayList<>(YamlNodes.stringList(node, context));
  }

  private static boolean isEntityId(String value) {
    int idx = value.indexOf('.');
    return idx > 0 && idx < value.length() - 1;
  }
}
