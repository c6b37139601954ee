package com.github.spud.sample.ai.orchestrator.domain.orchestration;

import com.github.spud.sample.ai.orchestrator.domain.evaluation.Evaluation;

/**
 * Evaluates a response, either as a plain score or with per-metric detail
 */
@FunctionalInterface
public interface EvaluationFunction {

  Evaluation evaluate(String response) throws Exception;
}
