package com.github.spud.sample.ai.orchestrator.domain.agent;

import lombok.Builder;
import lombok.Value;

/**
 * A single prompt sent to an agent
 */
@Value
@Builder
public class AgentRequest {

  String prompt;

  AgentProfile profile;

  /**
   * Refinement attempt number, 0 outside the refinement loop
   */
  int attempt;

  public static AgentRequest of(String prompt, AgentProfile profile) {
    return AgentRequest.builder().prompt(prompt).profile(profile).build();
  }
}
