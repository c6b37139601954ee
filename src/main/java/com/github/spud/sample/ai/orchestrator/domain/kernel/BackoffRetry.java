package com.github.spud.sample.ai.orchestrator.domain.kernel;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * 指数退避重试
 * <p>
 * 第 k 次（从 0 开始）失败后等待 baseDelay * 2^k，再叠加 [0, jitterRatio) 比例的随机抖动；
 * 最后一次失败后不再等待，直接抛出最后一个异常。
 */
@Slf4j
public class BackoffRetry {

  public static final double DEFAULT_JITTER_RATIO = 0.2;

  private static final int MAX_SHIFT = 20;

  private final Sleeper sleeper;
  private final double jitterRatio;
  private final DoubleSupplier random;

  @FunctionalInterface
  public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
  }

  public BackoffRetry() {
    this(DEFAULT_JITTER_RATIO);
  }

  public BackoffRetry(double jitterRatio) {
    this(duration -> Thread.sleep(duration.toMillis()), jitterRatio,
      () -> ThreadLocalRandom.current().nextDouble());
  }

  public BackoffRetry(Sleeper sleeper, double jitterRatio, DoubleSupplier random) {
    if (jitterRatio < 0) {
      throw new IllegalArgumentException("jitterRatio must not be negative");
    }
    this.sleeper = sleeper;
    this.jitterRatio = jitterRatio;
    this.random = random;
  }

  public <T> T execute(Callable<T> operation, int maxAttempts, Duration baseDelay)
    throws Exception {
    return execute(operation, maxAttempts, baseDelay, CancellationToken.none());
  }

  public <T> T execute(Callable<T> operation, int maxAttempts, Duration baseDelay,
    CancellationToken token) throws Exception {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    Exception lastError = null;
    for (int attempt = 0; attempt < maxAttempts; attempt++) {
      token.throwIfCancelled();
      try {
        return operation.call();
      } catch (OrchestrationCancelledException e) {
        throw e;
      } catch (Exception e) {
        lastError = e;
        if (attempt < maxAttempts - 1) {
          Duration delay = delayFor(attempt, baseDelay);
          log.debug("Attempt {}/{} failed ({}), retrying in {}ms", attempt + 1, maxAttempts,
            e.getMessage(), delay.toMillis());
          pause(delay);
        }
      }
    }
    throw lastError;
  }

  /**
   * 第 attempt 次失败后的等待时长（含抖动）
   */
  public Duration delayFor(int attempt, Duration baseDelay) {
    long exponential = baseDelay.toMillis() << Math.min(attempt, MAX_SHIFT);
    long jitter = (long) (exponential * jitterRatio * random.getAsDouble());
    return Duration.ofMillis(exponential + jitter);
  }

  private void pause(Duration delay) {
    if (delay.isZero()) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OrchestrationCancelledException("Retry backoff interrupted", e);
    }
  }
}
