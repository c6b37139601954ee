package com.github.spud.sample.ai.orchestrator.domain.evaluation;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 启发式打分（无外部测试服务时的兜底）
 */
public final class HeuristicScorer {

  private static final double BASE_SCORE = 0.5;
  private static final double LENGTH_BONUS = 0.1;
  private static final double PATTERN_BONUS = 0.05;

  private static final List<Pattern> PATTERNS = List.of(
    // 函数/变量声明
    Pattern.compile("\\b(function|def|const|let|var)\\s+\\w+"),
    // 类/接口
    Pattern.compile("\\b(class|interface)\\s+\\w+"),
    // 注释
    Pattern.compile("//|/\\*|#"),
    // 错误处理
    Pattern.compile("\\b(try|catch|except|error|Error)\\b")
  );

  private HeuristicScorer() {
  }

  public static double score(String text) {
    if (text == null || text.isEmpty()) {
      return 0.0;
    }
    double score = BASE_SCORE;
    if (text.length() > 50) {
      score += LENGTH_BONUS;
    }
    if (text.length() > 200) {
      score += LENGTH_BONUS;
    }
    for (Pattern pattern : PATTERNS) {
      if (pattern.matcher(text).find()) {
        score += PATTERN_BONUS;
      }
    }
    return clamp(score);
  }

  public static double clamp(double score) {
    return Math.max(0.0, Math.min(1.0, score));
  }
}
