package com.github.spud.sample.ai.orchestrator.domain.kernel;

/**
 * Raised at a cancellation checkpoint once the owning session has been cancelled.
 */
public class OrchestrationCancelledException extends RuntimeException {

  public OrchestrationCancelledException(String message) {
    super(message);
  }

  public OrchestrationCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
