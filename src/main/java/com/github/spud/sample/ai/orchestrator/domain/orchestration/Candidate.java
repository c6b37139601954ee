package com.github.spud.sample.ai.orchestrator.domain.orchestration;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Value;

/**
 * 一个探索分支的打分结果，生成后不可变
 */
@Value
@Builder
@NoArgsConstructor(force = true)
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Candidate {

  String name;
  String prompt;
  AgentProfile profile;
  String response;
  double score;
  long durationMs;
  boolean failed;
  String error;

  static Candidate failed(ExplorationVariant variant, String error, long durationMs) {
    return Candidate.builder()
      .name(variant.getName())
      .prompt(variant.getPrompt())
      .profile(variant.getProfile())
      .score(0.0)
      .durationMs(durationMs)
      .failed(true)
      .error(error)
      .build();
  }
}
