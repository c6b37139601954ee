package com.github.spud.sample.ai.orchestrator.domain.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Session orchestration mode
 */
public enum OrchestrationMode {
  /**
   * All configured variants are explored
   */
  QUALITY,

  /**
   * Only the first {@link #FAST_VARIANT_LIMIT} variants are explored
   */
  FAST,

  /**
   * Generate, critique and synthesize instead of parallel exploration
   */
  REFLECT;

  public static final int FAST_VARIANT_LIMIT = 2;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parse a mode name; blank means {@link #QUALITY}
   *
   * @throws IllegalArgumentException for unknown names
   */
  @JsonCreator
  public static OrchestrationMode from(String value) {
    if (value == null || value.isBlank()) {
      return QUALITY;
    }
    return OrchestrationMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
