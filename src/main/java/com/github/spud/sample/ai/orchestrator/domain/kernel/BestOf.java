package com.github.spud.sample.ai.orchestrator.domain.kernel;

import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * 从列表中选出得分最高的元素
 * <p>
 * 仅在后一个元素得分严格更高时替换，同分保留最早出现的元素；空列表返回 empty。
 */
public final class BestOf {

  private BestOf() {
  }

  public static <T> Optional<T> best(List<T> items, ToDoubleFunction<? super T> scoreFn) {
    if (items == null || items.isEmpty()) {
      return Optional.empty();
    }
    T best = items.get(0);
    double bestScore = scoreFn.applyAsDouble(best);
    for (int i = 1; i < items.size(); i++) {
      T current = items.get(i);
      double score = scoreFn.applyAsDouble(current);
      if (score > bestScore) {
        best = current;
        bestScore = score;
      }
    }
    return Optional.of(best);
  }
}
