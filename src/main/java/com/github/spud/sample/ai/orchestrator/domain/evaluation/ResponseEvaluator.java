package com.github.spud.sample.ai.orchestrator.domain.evaluation;

import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig;

/**
 * Scores an agent response against the session's quality settings.
 */
public interface ResponseEvaluator {

  Evaluation evaluate(String text, OrchestrationConfig config);
}
