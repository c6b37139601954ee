package com.github.spud.sample.ai.orchestrator.domain.session;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * 会话事件的进程内推送通道
 * <p>
 * 只有存在订阅者的会话才持有 sink，引用计数在订阅时加一、订阅结束时减一，归零即移除；
 * 事件本身以 KV 中的事件日志为准，这里仅用于唤醒流式推送
 */
@Slf4j
@Component
public class SessionEventBus {

  private static final Duration EMIT_RETRY = Duration.ofMillis(100);

  private final Map<String, Channel> channels = new ConcurrentHashMap<>();

  public void publish(String sessionId, SessionEvent event) {
    Channel channel = channels.get(sessionId);
    if (channel == null) {
      return;
    }
    channel.sink.emitNext(event, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
  }

  /**
   * sink 在订阅时才创建，未订阅的 Flux 不占用通道
   */
  public Flux<SessionEvent> subscribe(String sessionId) {
    return Flux.defer(() -> acquire(sessionId).sink.asFlux())
      .doFinally(signal -> release(sessionId));
  }

  private Channel acquire(String sessionId) {
    return channels.compute(sessionId, (id, channel) -> {
      Channel current = channel != null ? channel : new Channel();
      current.subscribers++;
      return current;
    });
  }

  private void release(String sessionId) {
    channels.computeIfPresent(sessionId,
      (id, channel) -> --channel.subscribers > 0 ? channel : null);
    log.debug("Released event channel for session {}", sessionId);
  }

  int channelCount() {
    return channels.size();
  }

  /**
   * 引用计数只在 ConcurrentHashMap 的 compute 中修改
   */
  private static final class Channel {

    private final Sinks.Many<SessionEvent> sink =
      Sinks.many().multicast().directBestEffort();
    private int subscribers;
  }
}
