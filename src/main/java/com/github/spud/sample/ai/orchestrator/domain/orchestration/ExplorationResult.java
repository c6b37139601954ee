package com.github.spud.sample.ai.orchestrator.domain.orchestration;

import java.util.List;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.Value;

/**
 * Output of parallel exploration. Candidates are in completion order; the winner is absent
 * when every variant failed.
 */
@Value
@NoArgsConstructor(force = true)
@AllArgsConstructor
public class ExplorationResult {

  List<Candidate> candidates;
  Candidate winner;
  String polished;

  public Optional<Candidate> findWinner() {
    return Optional.ofNullable(winner);
  }
}
