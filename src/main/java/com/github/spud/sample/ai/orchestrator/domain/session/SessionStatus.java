package com.github.spud.sample.ai.orchestrator.domain.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Session lifecycle status
 */
public enum SessionStatus {
  /**
   * Created, orchestration not yet scheduled
   */
  PENDING("pending"),

  RUNNING("running"),

  SUCCEEDED("succeeded"),

  /**
   * Refinement exhausted its attempts below the quality threshold
   */
  NEEDS_REVIEW("needs_review"),

  FAILED("failed"),

  CANCELLED("cancelled");

  private final String value;

  SessionStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static SessionStatus from(String value) {
    return Arrays.stream(values())
      .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
      .findFirst()
      .orElseThrow(() -> new IllegalArgumentException("Unknown session status: " + value));
  }

  public boolean isTerminal() {
    return this == SUCCEEDED || this == NEEDS_REVIEW || this == FAILED || this == CANCELLED;
  }
}
