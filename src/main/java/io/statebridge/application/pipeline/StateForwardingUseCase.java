package io.statebridge.application.pipeline;

import io.statebridge.application.dispatch.DispatchResult;
import io.statebridge.application.dispatch.EventDispatcher;
import io.statebridge.application.port.MetricsPort;
import io.statebridge.application.port.StateEventSource;
import io.statebridge.application.port.TopicPublisher;
import io.statebridge.domain.entity.StateChangeEvent;
import io.statebridge.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Pulls state-change events from a source and fans them out through the {@link EventDispatcher}
 * on a fixed set of single-threaded dispatch lanes.
 * <p>Each event goes to the lane selected by its entity id, so updates for one entity are published
 * in source order while different entities proceed in parallel.</p>
 * <p>Dispatch failures are logged and counted ({@code bridge.dispatch.error}) and never stop the
 * stream. The loop ends when a bounded source is exhausted, when {@link #stop()} is called, or when
 * the running thread is interrupted. Shutdown drains the lanes, then closes the publisher
 * (which flushes buffered records) and finally the source. Instances are not reusable; invoke
 * {@link #run()} at most once.</p>
 *
 * @since 0.1.0
 */
public final class StateForwardingUseCase {
  private static final Logger log = LoggerFactory.getLogger(StateForwardingUseCase.class);
  private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(30);
  private static final int QUEUE_SLOTS_PER_LANE = 128;

  private final StateEventSource source;
  private final EventDispatcher dispatcher;
  private final TopicPublisher publisher;
  private final MetricsPort metrics;
  private final int workers;
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicReference<Thread> runThread = new AtomicReference<>();
  private final LongAdder received = new LongAdder();
  private final LongAdder matched = new LongAdder();
  private final LongAdder errors = new LongAdder();
  private boolean used;

  /**
   * Wires the forwarding pipeline.
   *
   * @param source event source; started and closed by {@link #run()}
   * @param dispatcher dispatcher over the configured topics
   * @param publisher publisher used by {@code dispatcher}; closed by {@link #run()}
   * @param metrics metrics sink
   * @param workers number of dispatch lanes
   */
  public StateForwardingUseCase(
      StateEventSource source,
      EventDispatcher dispatcher,
      TopicPublisher publisher,
      MetricsPort metrics,
      int workers) {
    this.source = Objects.requireNonNull(source, "source");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    this.workers = workers;
  }

  /**
   * Runs the forwarding loop until the source is exhausted or the pipeline is stopped.
   *
   * @return counts for the run
   * @throws Exception if the source fails to start, poll or close, or the publisher fails to close
   */
  public ForwardingReport run() throws Exception {
    synchronized (this) {
      if (used) {
        throw new IllegalStateException("State forwarding already ran");
      }
      used = true;
    }
    runThread.set(Thread.currentThread());
    MDC.put("pipeline", "forward");
    UncaughtExceptionHandler crashHandler = (thread, ex) -> {
      errors.increment();
      metrics.increment("bridge.dispatch.error");
      log.error("Dispatch worker {} terminated unexpectedly", thread.getName(), ex);
    };
    List<ThreadPoolExecutor> lanes = new ArrayList<>(workers);
    for (int i = 0; i < workers; i++) {
      lanes.add(ExecutorFactories.newDispatchLane(i, QUEUE_SLOTS_PER_LANE, "statebridge-dispatch", crashHandler));
    }
    Exception primaryFailure = null;
    boolean started = false;
    try {
      source.start();
      started = true;
      log.info("Forwarding to {} topic(s) with {} dispatch lanes", dispatcher.router().size(), workers);
      while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
        Optional<StateChangeEvent> next;
        try {
          next = source.poll();
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          break;
        }
        if (next.isEmpty()) {
          if (source.isExhausted()) {
            break;
          }
          continue;
        }
        received.increment();
        StateChangeEvent event = next.get();
        try {
          laneFor(lanes, event).execute(() -> dispatchSafely(event));
        } catch (RejectedExecutionException ex) {
          errors.increment();
          metrics.increment("bridge.dispatch.error");
          log.warn("Dispatch lane rejected event for {}", event.entityId());
        }
      }
    } catch (Exception runFailure) {
      primaryFailure = runFailure;
    } finally {
      drain(lanes);
      try {
        publisher.close();
        log.info("Topic publisher closed");
      } catch (Exception closeFailure) {
        log.error("Failed to close topic publisher", closeFailure);
        if (primaryFailure == null) {
          primaryFailure = closeFailure;
        }
      }
      if (started) {
        try {
          source.close();
          log.info("Event source closed");
        } catch (Exception closeFailure) {
          log.error("Failed to close event source", closeFailure);
          if (primaryFailure == null) {
            primaryFailure = closeFailure;
          }
        }
      }
      runThread.set(null);
      MDC.remove("pipeline");
    }

    if (primaryFailure != null) {
      throw primaryFailure;
    }
    ForwardingReport report = new ForwardingReport(received.sum(), matched.sum(), errors.sum());
    log.info("Forwarding completed; received {} events, {} matched at least one topic, {} dispatch errors",
        report.received(), report.matched(), report.errors());
    return report;
  }

  /**
   * Requests the loop to stop after the current poll; safe to call from any thread.
   */
  public void stop() {
    stopRequested.set(true);
  }

  /**
   * Returns whether {@link #run()} is currently executing.
   *
   * @return {@code true} while running
   */
  public boolean isRunning() {
    return runThread.get() != null;
  }

  private void dispatchSafely(StateChangeEvent event) {
    MDC.put("pipeline", "forward");
    MDC.put("entity", event.entityId().value());
    try {
      DispatchResult result = dispatcher.dispatch(event);
      if (!result.matchedTopics().isEmpty()) {
        matched.increment();
      }
    } catch (RuntimeException ex) {
      errors.increment();
      metrics.increment("bridge.dispatch.error");
      log.error("Failed to dispatch event for {}", event.entityId(), ex);
    } finally {
      MDC.remove("entity");
    }
  }

  static int laneIndex(StateChangeEvent event, int laneCount) {
    return Math.floorMod(event.entityId().value().hashCode(), laneCount);
  }

  private static ThreadPoolExecutor laneFor(List<ThreadPoolExecutor> lanes, StateChangeEvent event) {
    return lanes.get(laneIndex(event, lanes.size()));
  }

  private void drain(List<ThreadPoolExecutor> lanes) {
    lanes.forEach(ThreadPoolExecutor::shutdown);
    long deadline = System.nanoTime() + DRAIN_TIMEOUT.toNanos();
    try {
      for (ThreadPoolExecutor lane : lanes) {
        long remaining = deadline - System.nanoTime();
        if (!lane.awaitTermination(Math.max(remaining, 0L), TimeUnit.NANOSECONDS)) {
          log.warn("Dispatch lane did not drain within {}; {} queued events dropped",
              DRAIN_TIMEOUT, lane.shutdownNow().size());
        }
      }
    } catch (InterruptedException ie) {
      lanes.forEach(ThreadPoolExecutor::shutdownNow);
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Counts for one forwarding run.
   *
   * @param received events read from the source
   * @param matched eligible events accepted by at least one topic
   * @param errors events whose dispatch failed unexpectedly
   */
  public record ForwardingReport(long received, long matched, long errors) {}
}
