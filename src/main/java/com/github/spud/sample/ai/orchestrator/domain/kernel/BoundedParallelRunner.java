package com.github.spud.sample.ai.orchestrator.domain.kernel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * 有界并发执行器
 * <p>
 * 最多 min(concurrency, items.size()) 个任务同时执行；单个任务失败只产生失败描述，不影响其他任务。
 * 结果按完成顺序返回，调用方不能假设与输入下标对齐。
 */
@Slf4j
public class BoundedParallelRunner {

  private final Scheduler scheduler;

  public BoundedParallelRunner() {
    this(Schedulers.boundedElastic());
  }

  public BoundedParallelRunner(Scheduler scheduler) {
    this.scheduler = scheduler;
  }

  @FunctionalInterface
  public interface TaskWorker<I, R> {

    R apply(I item) throws Exception;
  }

  public <I, R> List<TaskOutcome<I, R>> run(List<I> items, TaskWorker<I, R> worker,
    int concurrency) {
    return run(items, worker, concurrency, CancellationToken.none());
  }

  public <I, R> List<TaskOutcome<I, R>> run(List<I> items, TaskWorker<I, R> worker,
    int concurrency, CancellationToken token) {
    if (items == null || items.isEmpty()) {
      return List.of();
    }
    int lanes = Math.max(1, Math.min(concurrency, items.size()));
    List<TaskOutcome<I, R>> results = Collections.synchronizedList(new ArrayList<>(items.size()));

    log.debug("Running {} tasks on {} lanes", items.size(), lanes);
    Flux.fromIterable(items)
      .flatMap(item -> Mono.fromRunnable(() -> results.add(execute(item, worker, token)))
        .subscribeOn(scheduler), lanes)
      .then()
      .block();

    synchronized (results) {
      return new ArrayList<>(results);
    }
  }

  private <I, R> TaskOutcome<I, R> execute(I item, TaskWorker<I, R> worker,
    CancellationToken token) {
    try {
      token.throwIfCancelled();
      return TaskOutcome.success(item, worker.apply(item));
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.warn("Task failed for item {}: {}", item, e.getMessage());
      return TaskOutcome.failure(item, e);
    }
  }
}
