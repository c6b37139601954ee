package com.github.spud.sample.ai.orchestrator.domain.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCallException;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCaller;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentProfile;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentRequest;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentResponse;
import com.github.spud.sample.ai.orchestrator.domain.evaluation.Evaluation;
import com.github.spud.sample.ai.orchestrator.domain.evaluation.EvaluationMetrics;
import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/**
 * 迭代精炼阶段测试
 */
class IterativeRefinementStageTest {

  private static final AgentProfile PROFILE = AgentProfile.of("fast-small", 0.7);

  private final IterativeRefinementStage stage = new IterativeRefinementStage();

  private final List<AgentRequest> requests = new ArrayList<>();

  private AgentCaller countingCaller() {
    return (request, token) -> {
      requests.add(request);
      return AgentResponse.of("output " + requests.size());
    };
  }

  @Test
  void stopsAfterFirstAttemptWhenThresholdMet() {
    RefinementResult result = stage.refine("seed", countingCaller(),
      text -> Evaluation.scalar(1.0), 3, 0.85, PROFILE, CancellationToken.none());

    assertThat(result.isOk()).isTrue();
    assertThat(result.getAttemptCount()).isEqualTo(1);
    assertThat(result.getAttempts()).hasSize(1);
    assertThat(result.getBest()).isEqualTo("output 1");
    assertThat(requests).hasSize(1);
    assertThat(requests.get(0).getPrompt()).isEqualTo("seed");
  }

  @Test
  void exhaustsAttemptsBelowThreshold() {
    RefinementResult result = stage.refine("seed", countingCaller(),
      text -> Evaluation.scalar(0.0), 3, 0.85, PROFILE, CancellationToken.none());

    assertThat(result.isOk()).isFalse();
    assertThat(result.getAttempts()).hasSize(3);
    assertThat(result.getAttemptCount()).isEqualTo(3);
    assertThat(result.getAttempts()).extracting(RefinementAttempt::getAttempt)
      .containsExactly(1, 2, 3);
  }

  @Test
  void returnsBestNonFailedAttemptWhenExhausted() {
    double[] scores = {0.4, 0.8, 0.6};
    AtomicInteger index = new AtomicInteger();

    RefinementResult result = stage.refine("seed", countingCaller(),
      text -> Evaluation.scalar(scores[index.getAndIncrement()]), 3, 0.9, PROFILE,
      CancellationToken.none());

    assertThat(result.isOk()).isFalse();
    assertThat(result.getBest()).isEqualTo("output 2");
    assertThat(result.getBestScore()).isEqualTo(0.8);
  }

  @Test
  void nextPromptCarriesScoreFeedbackAndPreviousOutput() {
    stage.refine("seed", countingCaller(), text -> Evaluation.scalar(0.42), 2, 0.85, PROFILE,
      CancellationToken.none());

    assertThat(requests).hasSize(2);
    assertEquals("Previous attempt scored 0.42. "
        + "Major improvements needed. Focus on correctness and completeness.\n\n"
        + "Previous output:\n\noutput 1\n\nReturn only the improved version.",
      requests.get(1).getPrompt());
    assertThat(requests.get(1).getAttempt()).isEqualTo(2);
  }

  @Test
  void attemptFailureDoesNotAbortLoop() {
    AtomicInteger calls = new AtomicInteger();
    AgentCaller flaky = (request, token) -> {
      if (calls.incrementAndGet() == 1) {
        throw new AgentCallException("timeout");
      }
      return AgentResponse.of("recovered");
    };

    RefinementResult result = stage.refine("seed", flaky, text -> Evaluation.scalar(0.9), 3,
      0.85, PROFILE, CancellationToken.none());

    assertThat(result.isOk()).isTrue();
    assertThat(result.getAttempts()).hasSize(2);
    RefinementAttempt first = result.getAttempts().get(0);
    assertThat(first.isFailed()).isTrue();
    assertThat(first.getScore()).isZero();
    assertThat(first.getError()).isEqualTo("timeout");
  }

  @Test
  void allAttemptsFailingLeavesNoBest() {
    AgentCaller broken = (request, token) -> {
      throw new AgentCallException("down");
    };

    RefinementResult result = stage.refine("seed", broken, text -> Evaluation.scalar(1.0), 2,
      0.85, PROFILE, CancellationToken.none());

    assertThat(result.isOk()).isFalse();
    assertThat(result.getBest()).isNull();
    assertThat(result.getAttempts()).hasSize(2).allMatch(RefinementAttempt::isFailed);
  }

  @Test
  void structuredFeedbackListsWeakMetrics() {
    Evaluation evaluation = Evaluation.builder()
      .totalScore(0.6)
      .metrics(new EvaluationMetrics(0.5, 0.9, 0.6))
      .build();

    assertThat(IterativeRefinementStage.feedback(evaluation, 0.6))
      .isEqualTo("Improve correctness and handle edge cases. Improve code style and readability.");
  }

  @Test
  void structuredFeedbackFallsBackToGeneric() {
    Evaluation evaluation = Evaluation.builder()
      .totalScore(0.8)
      .metrics(new EvaluationMetrics(0.9, 0.9, 0.9))
      .build();

    assertThat(IterativeRefinementStage.feedback(evaluation, 0.8))
      .isEqualTo("General improvements needed.");
  }

  @Test
  void scalarFeedbackUsesScoreBands() {
    assertThat(IterativeRefinementStage.feedback(Evaluation.scalar(0.3), 0.3))
      .startsWith("Major");
    assertThat(IterativeRefinementStage.feedback(Evaluation.scalar(0.6), 0.6))
      .startsWith("Moderate");
    assertThat(IterativeRefinementStage.feedback(Evaluation.scalar(0.75), 0.75))
      .startsWith("Minor");
  }
}
