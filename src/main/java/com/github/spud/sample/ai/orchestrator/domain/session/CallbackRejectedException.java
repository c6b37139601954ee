package com.github.spud.sample.ai.orchestrator.domain.session;

/**
 * Inbound callback failed signature verification, or no callback secret is configured.
 */
public class CallbackRejectedException extends RuntimeException {

  public CallbackRejectedException(String message) {
    super(message);
  }
}
