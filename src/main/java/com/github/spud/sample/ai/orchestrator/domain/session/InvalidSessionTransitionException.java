package com.github.spud.sample.ai.orchestrator.domain.session;

import lombok.Getter;

/**
 * The requested trigger is not allowed from the session's current status.
 */
@Getter
public class InvalidSessionTransitionException extends RuntimeException {

  private final SessionStatus status;
  private final SessionTrigger trigger;

  public InvalidSessionTransitionException(SessionStatus status, SessionTrigger trigger) {
    super("Cannot apply " + trigger + " to a session in status " + status.getValue());
    this.status = status;
    this.trigger = trigger;
  }
}
