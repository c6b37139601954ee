package com.github.spud.sample.ai.orchestrator.domain.agent;

/**
 * Raised when the agent collaborator cannot produce a response.
 */
public class AgentCallException extends RuntimeException {

  public AgentCallException(String message) {
    super(message);
  }

  public AgentCallException(String message, Throwable cause) {
    super(message, cause);
  }
}
