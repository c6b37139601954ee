package com.github.spud.sample.ai.orchestrator.domain.session;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum StreamFrameType {
  EVENT,
  PLACEHOLDER,
  COMPLETE;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
