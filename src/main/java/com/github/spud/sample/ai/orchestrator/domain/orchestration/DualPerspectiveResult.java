package com.github.spud.sample.ai.orchestrator.domain.orchestration;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.Value;

/**
 * Raw outputs of the generate, critique and synthesize calls plus their lengths
 */
@Value
@NoArgsConstructor(force = true)
@AllArgsConstructor
public class DualPerspectiveResult {

  String generated;
  String critique;
  String synthesized;
  List<String> issues;
  Metadata metadata;

  @Value
  @NoArgsConstructor(force = true)
  @AllArgsConstructor
  public static class Metadata {

    int generatedLength;
    int critiqueLength;
    int synthesizedLength;
  }
}
