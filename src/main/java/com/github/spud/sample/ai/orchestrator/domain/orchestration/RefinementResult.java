package com.github.spud.sample.ai.orchestrator.domain.orchestration;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.Value;

/**
 * Outcome of the refinement loop. {@code ok} is true when an attempt reached the threshold;
 * otherwise {@code best} is the highest scoring non-failed attempt's response (null if all failed).
 */
@Value
@NoArgsConstructor(force = true)
@AllArgsConstructor
public class RefinementResult {

  boolean ok;
  List<RefinementAttempt> attempts;
  String best;
  double bestScore;
  int attemptCount;
}
