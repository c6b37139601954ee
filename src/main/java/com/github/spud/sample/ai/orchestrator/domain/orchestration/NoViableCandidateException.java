package com.github.spud.sample.ai.orchestrator.domain.orchestration;

/**
 * Every exploration variant failed, so there is nothing to refine or accept.
 */
public class NoViableCandidateException extends RuntimeException {

  public NoViableCandidateException(String message) {
    super(message);
  }
}
