package com.github.spud.sample.ai.orchestrator.domain.session;

import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCaller;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCallerFactory;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig.VariantSpec;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationMode;
import com.github.spud.sample.ai.orchestrator.domain.evaluation.Evaluation;
import com.github.spud.sample.ai.orchestrator.domain.evaluation.ResponseEvaluator;
import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;
import com.github.spud.sample.ai.orchestrator.domain.kernel.OrchestrationCancelledException;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.Candidate;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.DualPerspectiveResult;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.DualPerspectiveStage;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.ExplorationResult;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.ExplorationVariant;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.IterativeRefinementStage;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.NoViableCandidateException;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.ParallelExplorationStage;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.RefinementResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 会话编排流程
 * <p>
 * Phase 1：并行探索（reflect 模式下为生成-评审-综合）；Phase 2：得分低于阈值时迭代精炼。
 * 阶段之间检查取消令牌，所有写入要求会话仍处于 RUNNING。失败由调用方转为 FAILED。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionOrchestrator {

  static final String SOURCE_EXPLORATION = "exploration";
  static final String SOURCE_DUAL_PERSPECTIVE = "dual_perspective";
  static final String SOURCE_REFINEMENT = "refinement";

  private final SessionJournal journal;
  private final AgentCallerFactory agentCallerFactory;
  private final ResponseEvaluator evaluator;
  private final ParallelExplorationStage explorationStage;
  private final IterativeRefinementStage refinementStage;
  private final DualPerspectiveStage dualPerspectiveStage;

  public void orchestrate(String sessionId, CancellationToken token) throws Exception {
    SessionMeta meta = journal.require(sessionId);
    OrchestrationConfig config = meta.getConfig();
    OrchestrationMode mode = meta.getMode() != null ? meta.getMode() : OrchestrationMode.QUALITY;
    AgentCaller agentCaller = agentCallerFactory.create(config);

    journal.recordRunning(sessionId, EventLevel.INFO, "Starting orchestration",
      Map.of("mode", mode.value()));
    token.throwIfCancelled();

    Phase1 phase1;
    if (mode == OrchestrationMode.REFLECT && config.getOrchestration().isEnableReflectCritic()) {
      phase1 = reflect(meta, config, agentCaller, token);
    } else {
      if (mode == OrchestrationMode.REFLECT) {
        journal.recordRunning(sessionId, EventLevel.WARN,
          "Reflect critic disabled, falling back to parallel exploration", null);
      }
      phase1 = explore(meta, config, mode, agentCaller, token);
    }
    token.throwIfCancelled();

    double threshold = config.getQuality().getThreshold();
    if (phase1.score < threshold) {
      journal.recordRunning(sessionId, EventLevel.INFO,
        String.format(Locale.ROOT, "Score %.3f below threshold, refining...", phase1.score),
        Map.of("score", phase1.score, "threshold", threshold));

      // 精炼只看总分，反馈取分数段提示
      RefinementResult refinement = refinementStage.refine(phase1.text, agentCaller,
        text -> Evaluation.scalar(evaluator.evaluate(text, config).getTotalScore()),
        config.getOrchestration().getMaxIterations(), threshold,
        config.agentProfile(OrchestrationConfig.DEFAULT_AGENT), token);
      token.throwIfCancelled();

      FinalOutcome outcome = refinement.getBest() != null
        ? new FinalOutcome(refinement.isOk(), refinement.getBest(), refinement.getBestScore(),
        SOURCE_REFINEMENT)
        : new FinalOutcome(false, phase1.text, phase1.score, phase1.source);
      complete(sessionId, refinement.isOk() ? SessionTrigger.SUCCEED : SessionTrigger.FLAG_FOR_REVIEW,
        m -> {
          m.setRefinement(refinement);
          m.setOutcome(outcome);
        });
    } else {
      FinalOutcome outcome = new FinalOutcome(true, phase1.text, phase1.score, phase1.source);
      complete(sessionId, SessionTrigger.SUCCEED, m -> m.setOutcome(outcome));
    }
  }

  private Phase1 explore(SessionMeta meta, OrchestrationConfig config, OrchestrationMode mode,
    AgentCaller agentCaller, CancellationToken token) {
    String sessionId = meta.getId();
    List<ExplorationVariant> variants = buildVariants(meta.getPrompt(), config, mode);
    journal.recordRunning(sessionId, EventLevel.INFO, "Exploring parallel variants",
      Map.of("variants", variants.stream().map(ExplorationVariant::getName)
        .collect(Collectors.toList())));

    ExplorationResult exploration = explorationStage.explore(variants, agentCaller,
      text -> evaluator.evaluate(text, config).getTotalScore(),
      config.getOrchestration().getParallelConcurrency(),
      config.agentProfile(OrchestrationConfig.POLISH_AGENT), token);
    journal.updateRunning(sessionId, m -> m.setExploration(exploration));

    Candidate winner = exploration.findWinner()
      .orElseThrow(() -> new NoViableCandidateException(
        "All " + variants.size() + " exploration variants failed"));
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("score", winner.getScore());
    data.put("polished", exploration.getPolished() != null);
    journal.recordRunning(sessionId, EventLevel.INFO, "Winner selected: " + winner.getName(),
      data);

    if (exploration.getPolished() != null) {
      String polished = exploration.getPolished();
      return new Phase1(polished, evaluator.evaluate(polished, config).getTotalScore(),
        SOURCE_EXPLORATION);
    }
    return new Phase1(winner.getResponse(), winner.getScore(), SOURCE_EXPLORATION);
  }

  private Phase1 reflect(SessionMeta meta, OrchestrationConfig config, AgentCaller agentCaller,
    CancellationToken token) throws Exception {
    String sessionId = meta.getId();
    journal.recordRunning(sessionId, EventLevel.INFO, "Running generate, critique and synthesize",
      null);

    DualPerspectiveResult result = dualPerspectiveStage.run(meta.getPrompt(), agentCaller,
      config.agentProfile(OrchestrationConfig.CREATIVE_AGENT),
      config.agentProfile(OrchestrationConfig.CRITIC_AGENT),
      config.agentProfile(OrchestrationConfig.POLISH_AGENT), token);
    journal.updateRunning(sessionId, m -> m.setDualPerspective(result));

    double score = evaluator.evaluate(result.getSynthesized(), config).getTotalScore();
    journal.recordRunning(sessionId, EventLevel.INFO, "Synthesis complete",
      Map.of("issues", result.getIssues().size(), "score", score));
    return new Phase1(result.getSynthesized(), score, SOURCE_DUAL_PERSPECTIVE);
  }

  /**
   * prompt + modifier 组成变体；fast 模式只取前两个
   */
  static List<ExplorationVariant> buildVariants(String prompt, OrchestrationConfig config,
    OrchestrationMode mode) {
    List<VariantSpec> specs = config.getVariants();
    if (mode == OrchestrationMode.FAST && specs.size() > OrchestrationMode.FAST_VARIANT_LIMIT) {
      specs = specs.subList(0, OrchestrationMode.FAST_VARIANT_LIMIT);
    }
    return specs.stream()
      .map(spec -> new ExplorationVariant(spec.getName(),
        (prompt + "\n\n" + (spec.getModifier() != null ? spec.getModifier() : "")).trim(),
        config.agentProfile(spec.getAgentConfig())))
      .collect(Collectors.toList());
  }

  private void complete(String sessionId, SessionTrigger trigger,
    Consumer<SessionMeta> mutation) {
    SessionStatus target = trigger == SessionTrigger.SUCCEED
      ? SessionStatus.SUCCEEDED : SessionStatus.NEEDS_REVIEW;
    try {
      journal.transition(sessionId, trigger, mutation, EventLevel.INFO, "Orchestration complete",
        Map.of("status", target.getValue()));
    } catch (InvalidSessionTransitionException e) {
      // 与 cancel 竞争，取消优先
      throw new OrchestrationCancelledException(e.getMessage(), e);
    }
  }

  private static final class Phase1 {

    private final String text;
    private final double score;
    private final String source;

    private Phase1(String text, double score, String source) {
      this.text = text;
      this.score = score;
      this.source = source;
    }
  }
}
