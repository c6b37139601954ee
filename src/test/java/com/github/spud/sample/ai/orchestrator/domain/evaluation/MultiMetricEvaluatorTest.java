package com.github.spud.sample.ai.orchestrator.domain.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig;
import java.time.Duration;
import java.util.OptionalDouble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MultiMetricEvaluatorTest {

  @Mock
  private QuickTestScorer quickTestScorer;

  private MultiMetricEvaluator evaluator;
  private OrchestrationConfig config;

  @BeforeEach
  void setUp() {
    evaluator = new MultiMetricEvaluator(quickTestScorer);
    config = new OrchestrationConfig();
  }

  @Test
  void weightsQuickTestCorrectnessWithFixedMetrics() {
    when(quickTestScorer.score(eq("code"), eq(Duration.ofMillis(5000))))
      .thenReturn(OptionalDouble.of(1.0));

    Evaluation evaluation = evaluator.evaluate("code", config);

    // 1.0*0.4 + 0.7*0.3 + 0.7*0.3
    assertThat(evaluation.getTotalScore()).isCloseTo(0.82, within(1e-9));
    assertThat(evaluation.getMetrics().getCorrectness()).isEqualTo(1.0);
    assertThat(evaluation.getMetrics().getPerformance()).isEqualTo(0.7);
    assertThat(evaluation.getPassed()).isFalse();
    assertThat(evaluation.isStructured()).isTrue();
  }

  @Test
  void fallsBackToHeuristicWhenQuickTestUnavailable() {
    when(quickTestScorer.score(anyString(), any())).thenReturn(OptionalDouble.empty());
    String text = "function solve() { try { return 1; } catch (e) { } } // done";

    Evaluation evaluation = evaluator.evaluate(text, config);

    assertThat(evaluation.getMetrics().getCorrectness()).isEqualTo(HeuristicScorer.score(text));
  }

  @Test
  void skipsQuickTestsWhenDisabled() {
    config.getTesting().setEnableQuickTests(false);

    evaluator.evaluate("plain", config);

    verify(quickTestScorer, never()).score(anyString(), any());
  }

  @Test
  void passesAgainstConfiguredThreshold() {
    config.getQuality().setPassThreshold(0.5);
    when(quickTestScorer.score(anyString(), any())).thenReturn(OptionalDouble.of(0.9));

    assertThat(evaluator.evaluate("x", config).getPassed()).isTrue();
  }

  @Test
  void heuristicRewardsLengthAndPatterns() {
    assertThat(HeuristicScorer.score("")).isZero();
    assertThat(HeuristicScorer.score("short")).isEqualTo(0.5);
    String longCode = "class Parser {\n  // parse input\n"
      + "  def parse(self):\n    try:\n      pass\n    except Error:\n      pass\n".repeat(5)
      + "}";
    assertThat(HeuristicScorer.score(longCode)).isCloseTo(0.9, within(1e-9));
  }
}
