package com.github.spud.sample.ai.orchestrator.domain.session;

public class SessionNotFoundException extends RuntimeException {

  public SessionNotFoundException(String sessionId) {
    super("Session not found: " + sessionId);
  }
}
