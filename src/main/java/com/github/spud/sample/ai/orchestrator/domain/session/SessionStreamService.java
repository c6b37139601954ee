package com.github.spud.sample.ai.orchestrator.domain.session;

import com.github.spud.sample.ai.orchestrator.application.config.OrchestratorProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 会话流式推送
 * <p>
 * 新事件通过 {@link SessionEventBus} 即时唤醒，同时按固定间隔 tick 轮换占位消息并检查状态。
 * 以事件 seq 作为已发送游标；会话离开 RUNNING 后补发剩余事件并以 complete 帧结束。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionStreamService {

  private final SessionRepository repository;
  private final SessionEventBus eventBus;
  private final OrchestratorProperties properties;

  /**
   * @throws SessionNotFoundException 会话不存在
   */
  public Flux<StreamFrame> stream(String sessionId) {
    repository.requireMeta(sessionId);
    Duration tick = properties.getStream().getTickInterval();
    Cursor cursor = new Cursor();

    Flux<Boolean> ticks = Flux.interval(Duration.ZERO, tick).map(i -> Boolean.TRUE);
    Flux<Boolean> pushes = eventBus.subscribe(sessionId).map(e -> Boolean.FALSE);

    return Flux.merge(ticks, pushes)
      .onBackpressureLatest()
      .concatMap(isTick -> Mono.fromCallable(() -> drain(sessionId, cursor, isTick))
        .subscribeOn(Schedulers.boundedElastic())
        .flatMapMany(Flux::fromIterable), 1)
      .takeUntil(frame -> frame.getType() == StreamFrameType.COMPLETE)
      .doOnSubscribe(s -> log.debug("Stream opened for session {}", sessionId))
      .doFinally(signal -> log.debug("Stream closed for session {}: {}", sessionId, signal));
  }

  List<StreamFrame> drain(String sessionId, Cursor cursor, boolean isTick) {
    List<StreamFrame> frames = new ArrayList<>();
    if (cursor.completed) {
      return frames;
    }
    Optional<SessionMeta> meta = repository.findMeta(sessionId);
    for (SessionEvent event : repository.loadEvents(sessionId).after(cursor.lastSeq)) {
      frames.add(StreamFrame.event(event));
      cursor.lastSeq = event.getSeq();
    }

    SessionStatus status = meta.map(SessionMeta::getStatus).orElse(null);
    if (status == null || status.isTerminal()) {
      cursor.completed = true;
      frames.add(StreamFrame.complete(status));
    } else if (isTick) {
      frames.add(StreamFrame.placeholder(PlaceholderMessages.get(cursor.placeholderIndex++)));
    }
    return frames;
  }

  /**
   * 单个流的发送进度，由 concatMap 串行访问
   */
  static final class Cursor {

    private volatile long lastSeq;
    private volatile long placeholderIndex;
    private volatile boolean completed;
  }
}
