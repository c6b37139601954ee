package com.github.spud.sample.ai.orchestrator.domain.orchestration;

import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCaller;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentProfile;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentRequest;
import com.github.spud.sample.ai.orchestrator.domain.evaluation.Evaluation;
import com.github.spud.sample.ai.orchestrator.domain.evaluation.EvaluationMetrics;
import com.github.spud.sample.ai.orchestrator.domain.kernel.BestOf;
import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;
import com.github.spud.sample.ai.orchestrator.domain.kernel.OrchestrationCancelledException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * 迭代精炼阶段
 * <p>
 * 顺序执行：调用 agent → 评估 → 达到阈值立即返回；否则根据评估生成反馈并构造下一轮 prompt。
 * 单次尝试失败记为 failed 且 score=0，循环继续。
 */
@Slf4j
public class IterativeRefinementStage {

  static final double CORRECTNESS_CUTOFF = 0.8;
  static final double PERFORMANCE_CUTOFF = 0.7;
  static final double STYLE_CUTOFF = 0.7;

  public RefinementResult refine(String initialPrompt, AgentCaller agentCaller,
    EvaluationFunction evaluator, int maxAttempts, double threshold, AgentProfile profile,
    CancellationToken token) {
    List<RefinementAttempt> attempts = new ArrayList<>();
    String prompt = initialPrompt;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      token.throwIfCancelled();
      log.info("Refinement attempt {}/{}", attempt, maxAttempts);
      try {
        String response = agentCaller.call(AgentRequest.builder()
          .prompt(prompt)
          .profile(profile)
          .attempt(attempt)
          .build(), token).getText();
        Evaluation evaluation = evaluator.evaluate(response);
        double score = evaluation.getTotalScore();

        attempts.add(RefinementAttempt.builder()
          .attempt(attempt)
          .response(response)
          .score(score)
          .evaluation(evaluation.isStructured() ? evaluation : null)
          .timestamp(System.currentTimeMillis())
          .failed(false)
          .build());
        log.info("Attempt {} score: {}", attempt, String.format(Locale.ROOT, "%.3f", score));

        if (score >= threshold) {
          log.info("Quality threshold reached on attempt {}", attempt);
          return new RefinementResult(true, attempts, response, score, attempt);
        }
        prompt = nextPrompt(response, score, feedback(evaluation, score));
      } catch (OrchestrationCancelledException e) {
        throw e;
      } catch (Exception e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
          throw new OrchestrationCancelledException("Refinement interrupted", e);
        }
        log.error("Refinement attempt {} failed: {}", attempt, e.getMessage(), e);
        attempts.add(RefinementAttempt.builder()
          .attempt(attempt)
          .score(0.0)
          .timestamp(System.currentTimeMillis())
          .failed(true)
          .error(e.getMessage() != null ? e.getMessage() : e.toString())
          .build());
      }
    }

    List<RefinementAttempt> succeeded = attempts.stream()
      .filter(a -> !a.isFailed())
      .collect(Collectors.toList());
    Optional<RefinementAttempt> best = BestOf.best(succeeded, RefinementAttempt::getScore);
    log.warn("Refinement exhausted {} attempts without reaching threshold {}", maxAttempts,
      threshold);
    return new RefinementResult(false, attempts,
      best.map(RefinementAttempt::getResponse).orElse(null),
      best.map(RefinementAttempt::getScore).orElse(0.0),
      maxAttempts);
  }

  static String nextPrompt(String previousOutput, double score, String feedback) {
    return String.format(Locale.ROOT,
      "Previous attempt scored %.2f. %s\n\nPrevious output:\n\n%s\n\nReturn only the improved version.",
      score, feedback, previousOutput);
  }

  /**
   * 结构化评估按分项阈值生成反馈，否则按分数段给出固定提示
   */
  static String feedback(Evaluation evaluation, double score) {
    if (evaluation != null && evaluation.isStructured()) {
      EvaluationMetrics metrics = evaluation.getMetrics();
      List<String> clauses = new ArrayList<>();
      if (metrics.getCorrectness() < CORRECTNESS_CUTOFF) {
        clauses.add("Improve correctness and handle edge cases");
      }
      if (metrics.getPerformance() < PERFORMANCE_CUTOFF) {
        clauses.add("Optimize performance");
      }
      if (metrics.getStyle() < STYLE_CUTOFF) {
        clauses.add("Improve code style and readability");
      }
      return clauses.isEmpty() ? "General improvements needed." : String.join(". ", clauses) + ".";
    }
    if (score < 0.5) {
      return "Major improvements needed. Focus on correctness and completeness.";
    }
    if (score < 0.7) {
      return "Moderate improvements needed. Address correctness and quality issues.";
    }
    return "Minor improvements needed. Polish and refine.";
  }
}
