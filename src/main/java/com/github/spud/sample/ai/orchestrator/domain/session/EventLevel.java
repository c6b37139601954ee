package com.github.spud.sample.ai.orchestrator.domain.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum EventLevel {
  INFO,
  WARN,
  ERROR;

  @JsonValue
  public String getValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static EventLevel from(String value) {
    return EventLevel.valueOf(value.toUpperCase(Locale.ROOT));
  }
}
