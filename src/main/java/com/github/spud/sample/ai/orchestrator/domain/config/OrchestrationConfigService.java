package com.github.spud.sample.ai.orchestrator.domain.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig.VariantSpec;
import com.github.spud.sample.ai.orchestrator.domain.session.MalformedRequestException;
import com.github.spud.sample.ai.orchestrator.infrastructure.store.KeyValueStore;
import com.github.spud.sample.ai.orchestrator.infrastructure.util.JsonUtils;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Resolves the effective orchestration configuration: defaults, then the persisted override
 * layer, then per-request overrides.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrchestrationConfigService {

  public static final String CONFIG_KEY = "orchestration-config";

  private final KeyValueStore store;

  /**
   * Effective configuration without request overrides
   */
  public OrchestrationConfig effective() {
    return resolve(null);
  }

  /**
   * Merge all three layers and validate the result
   *
   * @throws MalformedRequestException if the merged document is not a valid configuration
   */
  public OrchestrationConfig resolve(Map<String, Object> requestOverrides) {
    JsonNode defaults = JsonUtils.toTree(new OrchestrationConfig());
    JsonNode persisted = loadPersisted().orElse(null);
    JsonNode request = requestOverrides != null ? JsonUtils.toTree(requestOverrides) : null;

    ObjectNode merged = ConfigLayering.merge(defaults, persisted, request);
    OrchestrationConfig config;
    try {
      config = JsonUtils.objectMapper().treeToValue(merged, OrchestrationConfig.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new MalformedRequestException("Invalid configuration override", e);
    }
    validate(config);
    return config;
  }

  /**
   * Replace the persisted override layer
   */
  public OrchestrationConfig saveOverrides(Map<String, Object> overrides) {
    if (overrides == null) {
      throw new MalformedRequestException("Configuration body is required");
    }
    JsonNode layer = JsonUtils.toTree(overrides);
    OrchestrationConfig candidate;
    try {
      candidate = JsonUtils.objectMapper().treeToValue(
        ConfigLayering.merge(JsonUtils.toTree(new OrchestrationConfig()), layer),
        OrchestrationConfig.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new MalformedRequestException("Invalid configuration document", e);
    }
    validate(candidate);

    store.put(CONFIG_KEY, JsonUtils.toJson(layer));
    log.info("Persisted orchestration config overrides: keys={}", overrides.keySet());
    return effective();
  }

  private Optional<JsonNode> loadPersisted() {
    try {
      return store.get(CONFIG_KEY).map(JsonUtils::readTree);
    } catch (Exception e) {
      log.warn("Failed to load persisted orchestration config: {}", e.getMessage());
      return Optional.empty();
    }
  }

  void validate(OrchestrationConfig config) {
    if (config.getOrchestration() == null || config.getQuality() == null) {
      throw new MalformedRequestException("orchestration and quality sections are required");
    }
    if (config.getOrchestration().getParallelConcurrency() < 1) {
      throw new MalformedRequestException("orchestration.parallelConcurrency must be >= 1");
    }
    if (config.getOrchestration().getMaxIterations() < 1) {
      throw new MalformedRequestException("orchestration.maxIterations must be >= 1");
    }
    if (!inUnitRange(config.getQuality().getThreshold())
      || !inUnitRange(config.getQuality().getPassThreshold())) {
      throw new MalformedRequestException("quality thresholds must be within [0, 1]");
    }
    if (config.getVariants() == null || config.getVariants().isEmpty()) {
      throw new MalformedRequestException("at least one variant is required");
    }
    for (VariantSpec variant : config.getVariants()) {
      if (variant == null || !StringUtils.hasText(variant.getName())) {
        throw new MalformedRequestException("every variant needs a name");
      }
    }
    if (config.getAgents() == null) {
      throw new MalformedRequestException("agents section is required");
    }
  }

  private static boolean inUnitRange(double value) {
    return value >= 0.0 && value <= 1.0;
  }
}
