package com.flamingo.ai.companybrain.service.support;

import com.flamingo.ai.companybrain.exception.CollaboratorCallException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Runs blocking collaborator calls (embedding, search, generation) with a timeout.
 *
 * <p>The timeout of each call is the configured per-call timeout capped by what is left of the
 * request deadline. A call that does not finish in time is cancelled (its worker thread is
 * interrupted) and reported as a timed-out {@link CollaboratorCallException}. Interrupting the
 * caller cancels the call the same way.
 */
@Component
@Slf4j
public class BoundedCallExecutor {

  private final AsyncTaskExecutor collaboratorCallExecutor;
  private final MeterRegistry meterRegistry;

  public BoundedCallExecutor(
      @Qualifier("collaboratorCallExecutor") AsyncTaskExecutor collaboratorCallExecutor,
      MeterRegistry meterRegistry) {
    this.collaboratorCallExecutor = collaboratorCallExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Executes the task and waits for its result.
   *
   * @param operation name used in logs, metrics and exception messages
   * @param perCallTimeout configured timeout for this kind of call
   * @param deadline request deadline
   * @param task the blocking call
   * @return the task's result
   * @throws CollaboratorCallException when the task fails, times out or the caller is interrupted
   */
  public <T> T call(
      String operation, Duration perCallTimeout, QueryDeadline deadline, Callable<T> task) {
    Duration timeout = deadline.cap(perCallTimeout);
    if (timeout.isZero()) {
      meterRegistry.counter("collaborator.call.timeout", "operation", operation).increment();
      throw CollaboratorCallException.timeout(operation, null);
    }

    TimeLimiter timeLimiter =
        TimeLimiter.of(
            operation,
            TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    Future<T> future;
    try {
      future = collaboratorCallExecutor.submit(task);
    } catch (TaskRejectedException e) {
      log.warn("{} rejected: collaborator call pool is saturated", operation);
      throw failure(operation, e);
    }
    try {
      return timeLimiter.executeFutureSupplier(() -> future);
    } catch (TimeoutException e) {
      log.warn("{} did not complete within {} ms", operation, timeout.toMillis());
      meterRegistry.counter("collaborator.call.timeout", "operation", operation).increment();
      throw CollaboratorCallException.timeout(operation, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw failure(operation, cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new CollaboratorCallException(operation, operation + " interrupted", e);
    } catch (Exception e) {
      future.cancel(true);
      throw failure(operation, e);
    }
  }

  private CollaboratorCallException failure(String operation, Throwable cause) {
    meterRegistry.counter("collaborator.call.failure", "operation", operation).increment();
    return new CollaboratorCallException(
        operation, operation + " failed: " + cause.getMessage(), cause);
  }
}
