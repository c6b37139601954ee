package com.github.spud.sample.ai.orchestrator.domain.orchestration;

/**
 * Maps a response to a score in [0, 1]
 */
@FunctionalInterface
public interface ScoreFunction {

  double score(String response) throws Exception;
}
