package com.github.spud.sample.ai.orchestrator.domain.kernel;

import lombok.Value;

/**
 * 并行任务的单项结果：成功结果或失败描述 {error, item, failed=true}
 */
@Value
public class TaskOutcome<I, R> {

  I item;
  R result;
  String error;
  boolean failed;

  public static <I, R> TaskOutcome<I, R> success(I item, R result) {
    return new TaskOutcome<>(item, result, null, false);
  }

  public static <I, R> TaskOutcome<I, R> failure(I item, Throwable error) {
    String message = error.getMessage() != null ? error.getMessage() : error.toString();
    return new TaskOutcome<>(item, null, message, true);
  }
}
