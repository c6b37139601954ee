package com.github.spud.sample.ai.orchestrator.domain.session;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话最终结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FinalOutcome {

  /**
   * 是否达到质量阈值
   */
  private boolean ok;

  private String text;

  private double score;

  /**
   * exploration / dual_perspective / refinement
   */
  private String source;
}
