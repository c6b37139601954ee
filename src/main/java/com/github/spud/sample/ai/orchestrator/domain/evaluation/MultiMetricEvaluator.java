package com.github.spud.sample.ai.orchestrator.domain.evaluation;

import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig.ScoreWeights;
import java.time.Duration;
import java.util.OptionalDouble;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 多指标评估：correctness 来自快速测试（或启发式兜底），performance/style 取固定值，按权重求和
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MultiMetricEvaluator implements ResponseEvaluator {

  static final double FIXED_PERFORMANCE = 0.7;
  static final double FIXED_STYLE = 0.7;

  private final QuickTestScorer quickTestScorer;

  @Override
  public Evaluation evaluate(String text, OrchestrationConfig config) {
    double correctness = correctness(text, config);
    EvaluationMetrics metrics = new EvaluationMetrics(correctness, FIXED_PERFORMANCE, FIXED_STYLE);

    ScoreWeights weights = config.getQuality().getScoreWeights() != null
      ? config.getQuality().getScoreWeights() : new ScoreWeights();
    double total = metrics.getCorrectness() * weights.getCorrectness()
      + metrics.getPerformance() * weights.getPerformance()
      + metrics.getStyle() * weights.getStyle();

    return Evaluation.builder()
      .totalScore(total)
      .metrics(metrics)
      .weights(weights)
      .passed(total >= config.getQuality().getPassThreshold())
      .build();
  }

  private double correctness(String text, OrchestrationConfig config) {
    OrchestrationConfig.Testing testing = config.getTesting();
    if (testing != null && testing.isEnableQuickTests()) {
      OptionalDouble quick = quickTestScorer.score(text,
        Duration.ofMillis(testing.getQuickTestTimeout()));
      if (quick.isPresent()) {
        return HeuristicScorer.clamp(quick.getAsDouble());
      }
    }
    return HeuristicScorer.score(text);
  }
}
