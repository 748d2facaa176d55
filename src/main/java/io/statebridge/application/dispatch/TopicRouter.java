package io.statebridge.application.dispatch;

import io.statebridge.application.filter.CompiledFilter;
import io.statebridge.application.filter.FilterCompiler;
import io.statebridge.domain.entity.EntityId;
import io.statebridge.domain.filter.FilterSpecification;
import io.statebridge.domain.filter.TopicConfiguration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves every topic's effective filter once and answers which topics an entity belongs to.
 *
 * <p>Effective filter per topic: the topic's own filter when present (it replaces the global filter
 * entirely), else the global filter when present, else match-all. Routes keep configuration
 * order. Instances are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class TopicRouter {
  private final List<TopicRoute> routes;

  private TopicRouter(List<TopicRoute> routes) {
    this.routes = routes;
  }

  /**
   * Resolves effective filters for the configured topics.
   *
   * @param topics topics in configuration order
   * @param globalFilter optional global filter
   * @return router over the resolved routes
   */
  public static TopicRouter resolve(List<TopicConfiguration> topics, Optional<FilterSpecification> globalFilter) {
    Objects.requireNonNull(topics, "topics");
    Objects.requireNonNull(globalFilter, "globalFilter");
    CompiledFilter compiledGlobal = globalFilter.map(FilterCompiler::compile).orElse(null);

    List<TopicRoute> routes = new ArrayList<>(topics.size());
    for (TopicConfiguration topic : topics) {
      Optional<FilterSpecification> own = topic.filter();
      if (own.isPresent()) {
        routes.add(new TopicRoute(
            topic.name(), TopicRoute.FilterOrigin.TOPIC, own.get(), FilterCompiler.compile(own.get())));
      } else if (compiledGlobal != null) {
        routes.add(new TopicRoute(
            topic.name(), TopicRoute.FilterOrigin.GLOBAL, globalFilter.get(), compiledGlobal));
      } else {
        routes.add(new TopicRoute(
            topic.name(), TopicRoute.FilterOrigin.MATCH_ALL, FilterSpecification.empty(), CompiledFilter.MATCH_ALL));
      }
    }
    return new TopicRouter(List.copyOf(routes));
  }

  /**
   * Evaluates the entity against every route.
   *
   * @param entityId entity to route
   * @return one decision per topic, in configuration order
   */
  public List<TopicDecision> decide(EntityId entityId) {
    Objects.requireNonNull(entityId, "entityId");
    List<TopicDecision> decisions = new ArrayList<>(routes.size());
    for (TopicRoute route : routes) {
      decisions.add(new TopicDecision(route.topic(), route.filter().test(entityId)));
    }
    return List.copyOf(decisions);
  }

  public List<TopicRoute> routes() {
    return routes;
  }

  public int size() {
    return routes.size();
  }
}
