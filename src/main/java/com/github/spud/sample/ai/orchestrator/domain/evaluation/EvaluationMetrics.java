package com.github.spud.sample.ai.orchestrator.domain.evaluation;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-dimension scores, each in [0, 1]
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationMetrics {

  private double correctness;
  private double performance;
  private double style;
}
