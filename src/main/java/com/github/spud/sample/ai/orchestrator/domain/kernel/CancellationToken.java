package com.github.spud.sample.ai.orchestrator.domain.kernel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * 协作式取消令牌，贯穿各阶段边界与 agent 调用
 * <p>
 * cancel() 只翻转一次；之后注册的回调立即执行
 */
@Slf4j
public class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  public static CancellationToken none() {
    return new CancellationToken();
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * 检查点：已取消则抛出 {@link OrchestrationCancelledException}
   */
  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new OrchestrationCancelledException("Operation cancelled");
    }
  }

  /**
   * 注册取消回调（例如中断正在执行的工作线程）
   */
  public void onCancel(Runnable callback) {
    callbacks.add(callback);
    if (cancelled.get() && callbacks.remove(callback)) {
      runQuietly(callback);
    }
  }

  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    for (Runnable callback : callbacks) {
      if (callbacks.remove(callback)) {
        runQuietly(callback);
      }
    }
  }

  private void runQuietly(Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      log.warn("Cancellation callback failed: {}", e.getMessage(), e);
    }
  }
}
