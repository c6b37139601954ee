package com.github.spud.sample.ai.orchestrator.domain.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * One frame on the session stream: a logged event, a rotating placeholder, or the final
 * completion marker
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamFrame {

  StreamFrameType type;
  Long seq;
  Long time;
  EventLevel level;
  String message;
  Object data;
  SessionStatus status;

  static StreamFrame event(SessionEvent event) {
    return StreamFrame.builder()
      .type(StreamFrameType.EVENT)
      .seq(event.getSeq())
      .time(event.getTime())
      .level(event.getLevel())
      .message(event.getMessage())
      .data(event.getData())
      .build();
  }

  static StreamFrame placeholder(String message) {
    return StreamFrame.builder().type(StreamFrameType.PLACEHOLDER).message(message).build();
  }

  static StreamFrame complete(SessionStatus status) {
    return StreamFrame.builder().type(StreamFrameType.COMPLETE).status(status).build();
  }
}
