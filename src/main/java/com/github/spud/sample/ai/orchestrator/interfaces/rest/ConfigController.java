package com.github.spud.sample.ai.orchestrator.interfaces.rest;

import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfigService;
import java.time.OffsetDateTime;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 编排配置与健康检查
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ConfigController {

  private final OrchestrationConfigService configService;

  @GetMapping("/config")
  public Mono<OrchestrationConfig> getConfig() {
    return Mono.fromCallable(configService::effective)
      .subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 替换持久化的配置覆盖层
   */
  @PutMapping("/config")
  public Mono<OrchestrationConfig> updateConfig(@RequestBody Map<String, Object> overrides) {
    return Mono.fromCallable(() -> configService.saveOverrides(overrides))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/health")
  public Mono<Map<String, Object>> health() {
    return Mono.just(Map.of("status", "ok", "timestamp", OffsetDateTime.now()));
  }
}
