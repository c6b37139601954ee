package com.github.spud.sample.ai.orchestrator.infrastructure.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.sample.ai.orchestrator.domain.evaluation.QuickTestScorer;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalDouble;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 通过 webhook 执行快速测试并读取通过率
 */
@Slf4j
@Component
public class WebhookQuickTestScorer implements QuickTestScorer {

  private final WebClient webClient;
  private final OrchestratorProperties.QuickTest settings;

  @Autowired
  public WebhookQuickTestScorer(WebClient.Builder webClientBuilder,
    OrchestratorProperties properties) {
    this(webClientBuilder.build(), properties.getQuickTest());
  }

  public WebhookQuickTestScorer(WebClient webClient, OrchestratorProperties.QuickTest settings) {
    this.webClient = webClient;
    this.settings = settings;
  }

  @Override
  public OptionalDouble score(String text, Duration timeout) {
    if (!StringUtils.hasText(settings.getWebhookUrl())) {
      log.debug("No quick-test webhook configured, falling back to heuristic scoring");
      return OptionalDouble.empty();
    }
    try {
      JsonNode result = webClient.post()
        .uri(settings.getWebhookUrl())
        .contentType(MediaType.APPLICATION_JSON)
        .headers(headers -> {
          if (StringUtils.hasText(settings.getSecret())) {
            headers.set(settings.getSecretHeader(), settings.getSecret());
          }
        })
        .bodyValue(Map.of("text", text != null ? text : "", "type", "quick-score"))
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(timeout)
        .block();
      OptionalDouble score = extractScore(result);
      if (score.isEmpty()) {
        log.warn("Quick-test webhook returned no usable score");
      }
      return score;
    } catch (Exception e) {
      log.warn("Quick-test scoring failed: {}", e.getMessage());
      return OptionalDouble.empty();
    }
  }

  /**
   * 依次读取 passRate / score / passed
   */
  static OptionalDouble extractScore(JsonNode result) {
    if (result == null) {
      return OptionalDouble.empty();
    }
    JsonNode passRate = result.get("passRate");
    if (passRate != null && passRate.isNumber()) {
      return OptionalDouble.of(clamp(passRate.asDouble()));
    }
    JsonNode score = result.get("score");
    if (score != null && score.isNumber()) {
      return OptionalDouble.of(clamp(score.asDouble()));
    }
    JsonNode passed = result.get("passed");
    if (passed != null && passed.isBoolean()) {
      return OptionalDouble.of(passed.asBoolean() ? 1.0 : 0.0);
    }
    return OptionalDouble.empty();
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
