package com.github.spud.sample.ai.orchestrator.domain.orchestration;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.spud.sample.ai.orchestrator.domain.evaluation.Evaluation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.NoArgsConstructor;
import lombok.Value;

/**
 * 一次精炼尝试，追加后不再修改
 */
@Value
@Builder
@NoArgsConstructor(force = true)
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefinementAttempt {

  int attempt;
  String response;
  double score;
  Evaluation evaluation;
  long timestamp;
  boolean failed;
  String error;
}
