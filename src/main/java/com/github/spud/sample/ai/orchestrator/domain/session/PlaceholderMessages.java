package com.github.spud.sample.ai.orchestrator.domain.session;

import java.util.List;

/**
 * Filler status lines rotated on the stream while a session is running
 */
public final class PlaceholderMessages {

  static final List<String> MESSAGES = List.of(
    "Thinking deeply about your request...",
    "Exploring different approaches...",
    "Running quality checks...",
    "Refining the solution...",
    "Applying best practices...",
    "Testing edge cases...",
    "Optimizing the output...",
    "Polishing the final result...",
    "Almost there...",
    "Finalizing..."
  );

  private PlaceholderMessages() {
  }

  public static String get(long index) {
    return MESSAGES.get((int) Math.floorMod(index, (long) MESSAGES.size()));
  }
}
