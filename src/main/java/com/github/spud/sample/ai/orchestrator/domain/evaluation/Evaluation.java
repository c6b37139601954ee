package com.github.spud.sample.ai.orchestrator.domain.evaluation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig.ScoreWeights;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 评估结果
 * <p>
 * 既可以是单一分数（metrics 为空），也可以是带分项指标的结构化评估
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Evaluation {

  private double totalScore;

  private EvaluationMetrics metrics;

  private ScoreWeights weights;

  private Boolean passed;

  public static Evaluation scalar(double score) {
    return Evaluation.builder().totalScore(score).build();
  }

  @JsonIgnore
  public boolean isStructured() {
    return metrics != null;
  }
}
