package ca.gc.cra.proxyrow.infrastructure.exec;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the worker pools used by parallel row decoding.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for row decoding workers.
   *
   * <p>The queue is unbounded so a whole batch can be submitted up front; workers are daemon threads and never
   * keep the JVM alive. Tasks must be submitted with {@code submit} so failures surface through their
   * {@code Future}.</p>
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @return configured executor service
   * @throws IllegalArgumentException if {@code size} is not positive
   */
  public static ExecutorService newDecodePool(int size, String prefix) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "proxyrow-decode" : prefix;
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
