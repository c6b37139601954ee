package com.github.spud.sample.ai.orchestrator.domain.agent;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent output. Only the text is used downstream.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AgentResponse {

  private String text;

  /**
   * 命中响应缓存时为 true
   */
  @JsonIgnore
  private boolean cached;

  public static AgentResponse of(String text) {
    return new AgentResponse(text != null ? text : "", false);
  }

  public static AgentResponse cached(String text) {
    return new AgentResponse(text != null ? text : "", true);
  }
}
