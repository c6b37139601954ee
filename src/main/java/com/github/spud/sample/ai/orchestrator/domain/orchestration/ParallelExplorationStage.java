package com.github.spud.sample.ai.orchestrator.domain.orchestration;

import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCaller;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentProfile;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentRequest;
import com.github.spud.sample.ai.orchestrator.domain.kernel.BestOf;
import com.github.spud.sample.ai.orchestrator.domain.kernel.BoundedParallelRunner;
import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;
import com.github.spud.sample.ai.orchestrator.domain.kernel.OrchestrationCancelledException;
import com.github.spud.sample.ai.orchestrator.domain.kernel.TaskOutcome;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 并行探索阶段
 * <p>
 * 以有界并发运行所有变体并打分，从未失败的候选中选出得分最高者；可选地再调用一次 agent 对胜者进行润色。
 * 单个变体失败记为 score=0 且 failed=true，润色失败只记录日志。
 */
@Slf4j
@RequiredArgsConstructor
public class ParallelExplorationStage {

  static final String POLISH_INSTRUCTION =
    "Polish and finalize the following result. Ensure correctness and quality:\n\n";

  private final BoundedParallelRunner runner;

  public ExplorationResult explore(List<ExplorationVariant> variants, AgentCaller agentCaller,
    ScoreFunction scorer, int concurrency, AgentProfile polishProfile, CancellationToken token) {
    log.info("Exploring {} variants with concurrency {}", variants.size(), concurrency);

    List<TaskOutcome<ExplorationVariant, Candidate>> outcomes = runner.run(variants,
      variant -> runVariant(variant, agentCaller, scorer, token), concurrency, token);

    List<Candidate> candidates = outcomes.stream()
      .map(outcome -> outcome.isFailed()
        ? Candidate.failed(outcome.getItem(), outcome.getError(), 0L)
        : outcome.getResult())
      .collect(Collectors.toList());
    token.throwIfCancelled();

    List<Candidate> viable = candidates.stream()
      .filter(candidate -> !candidate.isFailed())
      .collect(Collectors.toList());
    Optional<Candidate> winner = BestOf.best(viable, Candidate::getScore);

    if (winner.isEmpty()) {
      log.warn("No viable candidate: all {} variants failed", candidates.size());
      return new ExplorationResult(candidates, null, null);
    }
    log.info("Winner: {} with score {}", winner.get().getName(),
      String.format("%.3f", winner.get().getScore()));

    String polished = polishProfile != null
      ? polish(winner.get(), agentCaller, polishProfile, token) : null;
    return new ExplorationResult(candidates, winner.get(), polished);
  }

  private Candidate runVariant(ExplorationVariant variant, AgentCaller agentCaller,
    ScoreFunction scorer, CancellationToken token) {
    long start = System.currentTimeMillis();
    try {
      String response = agentCaller.call(AgentRequest.of(variant.getPrompt(), variant.getProfile()),
        token).getText();
      double score = scorer.score(response);
      long duration = System.currentTimeMillis() - start;
      log.info("Variant {}: score={}, duration={}ms", variant.getName(),
        String.format("%.3f", score), duration);
      return Candidate.builder()
        .name(variant.getName())
        .prompt(variant.getPrompt())
        .profile(variant.getProfile())
        .response(response)
        .score(score)
        .durationMs(duration)
        .failed(false)
        .build();
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.error("Variant {} failed: {}", variant.getName(), e.getMessage());
      String error = e.getMessage() != null ? e.getMessage() : e.toString();
      return Candidate.failed(variant, error, System.currentTimeMillis() - start);
    }
  }

  private String polish(Candidate winner, AgentCaller agentCaller, AgentProfile polishProfile,
    CancellationToken token) {
    log.info("Applying final polish to {}", winner.getName());
    try {
      return agentCaller.call(AgentRequest.of(POLISH_INSTRUCTION + winner.getResponse(),
        polishProfile), token).getText();
    } catch (OrchestrationCancelledException e) {
      throw e;
    } catch (Exception e) {
      log.warn("Polish failed, keeping unpolished winner: {}", e.getMessage());
      return null;
    }
  }
}
