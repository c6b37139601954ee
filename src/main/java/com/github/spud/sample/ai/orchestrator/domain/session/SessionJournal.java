package com.github.spud.sample.ai.orchestrator.domain.session;

import com.github.spud.sample.ai.orchestrator.domain.kernel.OrchestrationCancelledException;
import java.time.Clock;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 会话写入入口
 * <p>
 * 所有对 meta 和事件日志的修改都在会话锁内完成；状态变更经过状态机校验。
 * 同一次写入中先落事件再落 meta，读到终态 meta 的读者一定能读到对应事件；
 * 推送在两者都落盘之后发出，被唤醒的流读到的是本次写入后的 meta。
 */
@Slf4j
@Component
public class SessionJournal {

  private final SessionRepository repository;
  private final SessionLocks locks;
  private final SessionEventBus eventBus;
  private final SessionStateMachineDriver stateMachine;
  private final Clock clock;

  @Autowired
  public SessionJournal(SessionRepository repository, SessionLocks locks,
    SessionEventBus eventBus, SessionStateMachineDriver stateMachine) {
    this(repository, locks, eventBus, stateMachine, Clock.systemUTC());
  }

  public SessionJournal(SessionRepository repository, SessionLocks locks,
    SessionEventBus eventBus, SessionStateMachineDriver stateMachine, Clock clock) {
    this.repository = repository;
    this.locks = locks;
    this.eventBus = eventBus;
    this.stateMachine = stateMachine;
    this.clock = clock;
  }

  public long now() {
    return clock.millis();
  }

  public SessionMeta require(String sessionId) {
    return repository.requireMeta(sessionId);
  }

  /**
   * 新建会话并立即执行 START，返回的 meta 处于 RUNNING
   */
  public SessionMeta create(SessionMeta meta, String message) {
    return locks.withLock(meta.getId(), () -> {
      meta.setStatus(stateMachine.fire(SessionStatus.PENDING, SessionTrigger.START));
      meta.setCreatedAt(now());
      meta.setUpdatedAt(meta.getCreatedAt());
      SessionEvent event = storeEvent(meta.getId(), EventLevel.INFO, message, null);
      repository.saveMeta(meta);
      eventBus.publish(meta.getId(), event);
      return meta;
    });
  }

  /**
   * 修改 meta，不改变状态
   */
  public SessionMeta update(String sessionId, Consumer<SessionMeta> mutation, EventLevel level,
    String message, Object data) {
    return locks.withLock(sessionId, () -> {
      SessionMeta meta = repository.requireMeta(sessionId);
      mutation.accept(meta);
      meta.setUpdatedAt(now());
      SessionEvent event = message != null ? storeEvent(sessionId, level, message, data) : null;
      repository.saveMeta(meta);
      publish(sessionId, event);
      return meta;
    });
  }

  /**
   * 编排过程中的写入，要求会话仍处于 RUNNING
   *
   * @throws OrchestrationCancelledException 会话已离开 RUNNING（通常是被取消）
   */
  public SessionMeta updateRunning(String sessionId, Consumer<SessionMeta> mutation) {
    return locks.withLock(sessionId, () -> {
      SessionMeta meta = requireRunning(sessionId);
      mutation.accept(meta);
      meta.setUpdatedAt(now());
      repository.saveMeta(meta);
      return meta;
    });
  }

  /**
   * 编排过程中的事件，要求会话仍处于 RUNNING
   */
  public SessionEvent recordRunning(String sessionId, EventLevel level, String message,
    Object data) {
    return locks.withLock(sessionId, () -> {
      requireRunning(sessionId);
      return appendEvent(sessionId, level, message, data);
    });
  }

  /**
   * 追加事件，不检查状态
   */
  public SessionEvent record(String sessionId, EventLevel level, String message, Object data) {
    return locks.withLock(sessionId, () -> appendEvent(sessionId, level, message, data));
  }

  /**
   * 状态转换 + meta 修改 + 事件，原子执行
   *
   * @throws InvalidSessionTransitionException 当前状态不接受 trigger
   */
  public SessionMeta transition(String sessionId, SessionTrigger trigger,
    Consumer<SessionMeta> mutation, EventLevel level, String message, Object data) {
    return locks.withLock(sessionId, () -> {
      SessionMeta meta = repository.requireMeta(sessionId);
      SessionStatus next = stateMachine.fire(meta.getStatus(), trigger);
      mutation.accept(meta);
      meta.setStatus(next);
      meta.setUpdatedAt(now());
      SessionEvent event = message != null ? storeEvent(sessionId, level, message, data) : null;
      repository.saveMeta(meta);
      publish(sessionId, event);
      log.info("Session {} status -> {}", sessionId, next.getValue());
      return meta;
    });
  }

  private SessionMeta requireRunning(String sessionId) {
    SessionMeta meta = repository.requireMeta(sessionId);
    if (meta.getStatus() != SessionStatus.RUNNING) {
      throw new OrchestrationCancelledException(
        "Session " + sessionId + " is no longer running: " + meta.getStatus().getValue());
    }
    return meta;
  }

  /**
   * 只写事件、不改 meta 的写入，落盘后立即推送
   */
  private SessionEvent appendEvent(String sessionId, EventLevel level, String message,
    Object data) {
    SessionEvent event = storeEvent(sessionId, level, message, data);
    eventBus.publish(sessionId, event);
    return event;
  }

  private SessionEvent storeEvent(String sessionId, EventLevel level, String message,
    Object data) {
    EventLog events = repository.loadEvents(sessionId);
    SessionEvent event = events.append(level, message, data, now());
    repository.saveEvents(sessionId, events);
    return event;
  }

  private void publish(String sessionId, SessionEvent event) {
    if (event != null) {
      eventBus.publish(sessionId, event);
    }
  }
}
