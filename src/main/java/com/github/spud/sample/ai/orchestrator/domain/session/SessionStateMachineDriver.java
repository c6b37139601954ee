package com.github.spud.sample.ai.orchestrator.domain.session;

import java.util.EnumSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.statemachine.support.DefaultStateMachineContext;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 会话状态机驱动器
 * <pre>
 * 状态流转:
 *   PENDING --(START)--> RUNNING
 *   RUNNING --(SUCCEED)--> SUCCEEDED
 *   RUNNING --(FLAG_FOR_REVIEW)--> NEEDS_REVIEW
 *   RUNNING --(FAIL)--> FAILED
 *   PENDING --(CANCEL)--> CANCELLED
 *   RUNNING --(CANCEL)--> CANCELLED
 * </pre>
 * 会话状态持久化在 KV 存储中，每次转换都将一个新状态机实例重置到当前状态后再发送事件。终态不接受任何事件。
 */
@Slf4j
@Component
public class SessionStateMachineDriver {

  /**
   * 计算 trigger 作用于 current 后的新状态
   *
   * @throws InvalidSessionTransitionException 当前状态不接受该事件
   */
  public SessionStatus fire(SessionStatus current, SessionTrigger trigger) {
    if (current.isTerminal()) {
      log.warn("Event {} rejected in terminal status {}", trigger, current);
      throw new InvalidSessionTransitionException(current, trigger);
    }
    StateMachine<SessionStatus, SessionTrigger> sm = create(current);
    try {
      StateMachineEventResult<SessionStatus, SessionTrigger> result = sm
        .sendEvent(Mono.just(MessageBuilder.withPayload(trigger).build()))
        .blockFirst();

      boolean accepted = result != null
        && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;
      if (!accepted) {
        log.warn("Event {} rejected in status {}", trigger, current);
        throw new InvalidSessionTransitionException(current, trigger);
      }
      SessionStatus next = sm.getState().getId();
      log.debug("Event {} accepted: {} -> {}", trigger, current, next);
      return next;
    } finally {
      sm.stopReactively().block();
    }
  }

  private StateMachine<SessionStatus, SessionTrigger> create(SessionStatus current) {
    StateMachine<SessionStatus, SessionTrigger> sm = build();
    sm.getStateMachineAccessor().doWithAllRegions(access -> access
      .resetStateMachineReactively(new DefaultStateMachineContext<>(current, null, null, null))
      .block());
    sm.startReactively().block();
    return sm;
  }

  static StateMachine<SessionStatus, SessionTrigger> build() {
    try {
      StateMachineBuilder.Builder<SessionStatus, SessionTrigger> builder = StateMachineBuilder.builder();
      builder.configureConfiguration()
        .withConfiguration()
        .autoStartup(false);

      builder.configureStates()
        .withStates()
        .initial(SessionStatus.PENDING)
        .states(EnumSet.allOf(SessionStatus.class))
        .end(SessionStatus.SUCCEEDED)
        .end(SessionStatus.NEEDS_REVIEW)
        .end(SessionStatus.FAILED)
        .end(SessionStatus.CANCELLED);

      builder.configureTransitions()
        .withExternal()
        .source(SessionStatus.PENDING).target(SessionStatus.RUNNING)
        .event(SessionTrigger.START)
        .and()

        .withExternal()
        .source(SessionStatus.RUNNING).target(SessionStatus.SUCCEEDED)
        .event(SessionTrigger.SUCCEED)
        .and()
        .withExternal()
        .source(SessionStatus.RUNNING).target(SessionStatus.NEEDS_REVIEW)
        .event(SessionTrigger.FLAG_FOR_REVIEW)
        .and()

        // 错误处理
        .withExternal()
        .source(SessionStatus.RUNNING).target(SessionStatus.FAILED)
        .event(SessionTrigger.FAIL)
        .and()

        // 取消
        .withExternal()
        .source(SessionStatus.PENDING).target(SessionStatus.CANCELLED)
        .event(SessionTrigger.CANCEL)
        .and()
        .withExternal()
        .source(SessionStatus.RUNNING).target(SessionStatus.CANCELLED)
        .event(SessionTrigger.CANCEL);

      return builder.build();
    } catch (Exception e) {
      throw new IllegalStateException("Failed to build session state machine", e);
    }
  }
}
