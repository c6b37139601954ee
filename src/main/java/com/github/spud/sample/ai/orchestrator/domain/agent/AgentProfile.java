package com.github.spud.sample.ai.orchestrator.domain.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Model settings for one agent role (draft, polish, critic, creative...)
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentProfile {

  private String model;

  private Double temperature;

  /**
   * Upper bound on generated tokens, filled from the budget section when absent
   */
  private Integer maxTokens;

  public static AgentProfile of(String model, double temperature) {
    return AgentProfile.builder().model(model).temperature(temperature).build();
  }
}
