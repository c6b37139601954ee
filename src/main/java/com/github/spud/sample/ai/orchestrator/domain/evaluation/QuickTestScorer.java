package com.github.spud.sample.ai.orchestrator.domain.evaluation;

import java.time.Duration;
import java.util.OptionalDouble;

/**
 * External quick-test runner. Returns empty when no result could be obtained, in which case
 * callers fall back to {@link HeuristicScorer}.
 */
public interface QuickTestScorer {

  OptionalDouble score(String text, Duration timeout);
}
