package com.github.spud.sample.ai.orchestrator.domain.session;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A verified callback received from an external workflow
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InboundCallback {

  private String source;

  private long receivedAt;

  private Object payload;
}
