package io.statebridge.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Factory helpers for the bridge's dispatch lanes.
 */
public final class ExecutorFactories {

  private static final RejectedExecutionHandler BLOCK_UNTIL_QUEUED = (task, executor) -> {
    if (executor.isShutdown()) {
      throw new RejectedExecutionException("dispatch lane is shut down");
    }
    try {
      executor.getQueue().put(task);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new RejectedExecutionException("interrupted while waiting for a dispatch lane", ie);
    }
  };

  private ExecutorFactories() {}

  /**
   * Builds one single-threaded dispatch lane.
   *
   * <p>Tasks on a lane run strictly in submission order. The work queue is bounded; once it is full
   * the submitting thread blocks until the lane frees a slot, which throttles the event source
   * without running a task out of order.</p>
   *
   * @param index lane number, appended to the thread name
   * @param queueCapacity number of events that may wait on the lane
   * @param prefix thread-name prefix used to tag lane threads
   * @param handler uncaught exception handler installed on the lane thread
   * @return configured executor
   */
  public static ThreadPoolExecutor newDispatchLane(
      int index, int queueCapacity, String prefix, UncaughtExceptionHandler handler) {
    if (index < 0) {
      throw new IllegalArgumentException("index must not be negative");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    String threadName = ((prefix == null || prefix.isBlank()) ? "statebridge-dispatch" : prefix) + "-" + index;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadName);
          thread.setDaemon(false);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        factory,
        BLOCK_UNTIL_QUEUED);
  }
}
