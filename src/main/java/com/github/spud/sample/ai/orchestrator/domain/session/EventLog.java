package com.github.spud.sample.ai.orchestrator.domain.session;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Data;

/**
 * Append-only event log capped at {@link #CAPACITY} entries; the oldest entries are evicted
 * first. {@code nextSeq} keeps counting across evictions.
 */
@Data
public class EventLog {

  public static final int CAPACITY = 100;

  private long nextSeq = 1;

  private List<SessionEvent> events = new ArrayList<>();

  public SessionEvent append(EventLevel level, String message, Object data, long time) {
    SessionEvent event = SessionEvent.builder()
      .seq(nextSeq++)
      .time(time)
      .level(level)
      .message(message)
      .data(data)
      .build();
    events.add(event);
    if (events.size() > CAPACITY) {
      events.subList(0, events.size() - CAPACITY).clear();
    }
    return event;
  }

  /**
   * Events with a sequence number greater than {@code seq}, oldest first
   */
  public List<SessionEvent> after(long seq) {
    return events.stream()
      .filter(event -> event.getSeq() > seq)
      .collect(Collectors.toList());
  }
}
