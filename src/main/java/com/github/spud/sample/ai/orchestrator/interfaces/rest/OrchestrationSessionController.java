package com.github.spud.sample.ai.orchestrator.interfaces.rest;

import com.github.spud.sample.ai.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.sample.ai.orchestrator.domain.session.OrchestrationSessionService;
import com.github.spud.sample.ai.orchestrator.domain.session.SessionMeta;
import com.github.spud.sample.ai.orchestrator.domain.session.SessionStatus;
import com.github.spud.sample.ai.orchestrator.domain.session.SessionStatusView;
import com.github.spud.sample.ai.orchestrator.domain.session.SessionStreamService;
import com.github.spud.sample.ai.orchestrator.domain.session.StreamFrame;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Orchestration Session Api
 */
@Slf4j
@RestController
@RequestMapping("/session")
@RequiredArgsConstructor
public class OrchestrationSessionController {

  private final OrchestrationSessionService sessionService;
  private final SessionStreamService streamService;
  private final OrchestratorProperties properties;

  /**
   * 发起一个新的编排会话，编排在后台执行
   */
  @PostMapping("/start")
  public Mono<StartSessionResponse> start(@Valid @RequestBody StartSessionRequest request) {
    return Mono.fromCallable(() -> {
        log.info("Starting session: mode={}, promptLength={}", request.getMode(),
          request.getPrompt().length());
        SessionMeta meta = sessionService.start(request.getPrompt(), request.getMode(),
          request.getOptions());
        return new StartSessionResponse(meta.getId(), "/session/" + meta.getId());
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{id}")
  public Mono<SessionStatusView> get(@PathVariable String id) {
    return status(id);
  }

  @GetMapping("/{id}/status")
  public Mono<SessionStatusView> status(@PathVariable String id) {
    return Mono.fromCallable(() -> sessionService.status(id))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping("/{id}/cancel")
  public Mono<CancelSessionResponse> cancel(@PathVariable String id) {
    return Mono.fromCallable(() -> {
        SessionMeta meta = sessionService.cancel(id);
        return new CancelSessionResponse(meta.getId(), meta.getStatus());
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 外部工作流回调，按原始请求体字节校验签名
   */
  @PostMapping(value = "/{id}/callback", consumes = MediaType.ALL_VALUE)
  public Mono<Map<String, String>> callback(@PathVariable String id,
    @RequestBody(required = false) byte[] body, ServerHttpRequest request) {
    HttpHeaders headers = request.getHeaders();
    String signature = headers.getFirst(properties.getCallback().getSignatureHeader());
    Charset charset = Optional.ofNullable(headers.getContentType())
      .map(MediaType::getCharset)
      .orElse(StandardCharsets.UTF_8);
    return Mono.fromCallable(() -> {
        sessionService.callback(id, body, charset, signature);
        return Map.of("status", "ok");
      })
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ServerSentEvent<StreamFrame>> stream(@PathVariable String id) {
    return Mono.fromCallable(() -> streamService.stream(id))
      .subscribeOn(Schedulers.boundedElastic())
      .flatMapMany(frames -> frames)
      .map(frame -> {
        ServerSentEvent.Builder<StreamFrame> event = ServerSentEvent.builder(frame);
        if (frame.getSeq() != null) {
          event.id(String.valueOf(frame.getSeq()));
        }
        return event.build();
      });
  }

  // ===== DTOs =====

  @Data
  public static class StartSessionRequest {

    @NotBlank(message = "prompt is required")
    private String prompt;

    /**
     * quality / fast / reflect
     */
    private String mode;

    /**
     * 请求级配置覆盖
     */
    private Map<String, Object> options;
  }

  @Data
  @AllArgsConstructor
  public static class StartSessionResponse {

    private String id;
    private String sessionUrl;
  }

  @Data
  @AllArgsConstructor
  public static class CancelSessionResponse {

    private String id;
    private SessionStatus status;
  }
}
