package com.github.spud.sample.ai.orchestrator.interfaces.rest;

import com.github.spud.sample.ai.orchestrator.domain.agent.AgentResponse;
import com.github.spud.sample.ai.orchestrator.domain.proxy.ProxyService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 旧版单次调用入口
 */
@RestController
@RequiredArgsConstructor
public class ProxyController {

  static final String CACHE_HEADER = "X-Cache";

  private final ProxyService proxyService;

  @PostMapping("/proxy")
  public Mono<ResponseEntity<Map<String, String>>> proxy(@Valid @RequestBody ProxyRequest request) {
    return Mono.fromCallable(() -> {
        AgentResponse response = proxyService.call(request.getPrompt());
        return ResponseEntity.ok()
            .header(CACHE_HEADER, response.isCached() ? "HIT" : "MISS")
            .body(Map.of("text", response.getText()));
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @Data
  public static class ProxyRequest {

    @NotBlank(message = "Missing prompt")
    private String prompt;
  }
}
