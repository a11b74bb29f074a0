package com.codeheadsystems.warden.server.resilience;

import com.codeheadsystems.warden.server.metrics.SecurityMetrics;
import com.codeheadsystems.warden.server.store.StoreUnavailableException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs store calls with a deadline. A call that times out or fails is reported to the
 * {@link OutageTracker} and surfaces as {@link StoreUnavailableException}; what to do about it is
 * the caller's decision.
 */
public class StoreCallGuard {

  private final String storeName;
  private final Duration timeout;
  private final ExecutorService executor;
  private final OutageTracker tracker;
  private final SecurityMetrics metrics;

  public StoreCallGuard(final String storeName,
                        final Duration timeout,
                        final ExecutorService executor,
                        final OutageTracker tracker,
                        final SecurityMetrics metrics) {
    this.storeName = storeName;
    this.timeout = timeout;
    this.executor = executor;
    this.tracker = tracker;
    this.metrics = metrics;
  }

  public <T> T call(final String operation, final Callable<T> call) {
    final Future<T> future;
    try {
      future = executor.submit(call);
    } catch (RejectedExecutionException e) {
      throw fail(operation, e, false);
    }
    try {
      final T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      tracker.recordSuccess();
      return result;
    } catch (TimeoutException e) {
      future.cancel(true);
      throw fail(operation, e, true);
    } catch (ExecutionException e) {
      throw fail(operation, e.getCause() == null ? e : e.getCause(), false);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw fail(operation, e, false);
    }
  }

  public void run(final String operation, final Runnable call) {
    call(operation, () -> {
      call.run();
      return null;
    });
  }

  public OutageTracker tracker() {
    return tracker;
  }

  private StoreUnavailableException fail(final String operation, final Throwable cause, final boolean timedOut) {
    tracker.recordFailure(operation, cause);
    if (timedOut) {
      metrics.storeTimeout(storeName);
    } else {
      metrics.storeFailure(storeName);
    }
    final String message = timedOut
        ? storeName + " store " + operation + " timed out after " + timeout.toMillis() + "ms"
        : storeName + " store " + operation + " failed";
    return new StoreUnavailableException(message, cause);
  }
}
