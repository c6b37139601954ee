package com.github.spud.sample.ai.orchestrator.domain.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话事件
 * <p>
 * seq 在同一会话内单调递增，作为流式推送的游标
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionEvent {

  private long seq;

  /**
   * epoch millis
   */
  private long time;

  private EventLevel level;

  private String message;

  private Object data;
}
