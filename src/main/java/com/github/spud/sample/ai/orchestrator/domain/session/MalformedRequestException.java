package com.github.spud.sample.ai.orchestrator.domain.session;

/**
 * Inbound payload is syntactically or semantically invalid. Always a client error, never an
 * internal failure.
 */
public class MalformedRequestException extends RuntimeException {

  public MalformedRequestException(String message) {
    super(message);
  }

  public MalformedRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
