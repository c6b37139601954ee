package com.github.spud.sample.ai.orchestrator.domain.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfigService;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationMode;
import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;
import com.github.spud.sample.ai.orchestrator.domain.kernel.OrchestrationCancelledException;
import com.github.spud.sample.ai.orchestrator.infrastructure.security.HmacSigner;
import com.github.spud.sample.ai.orchestrator.infrastructure.util.JsonUtils;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Business service for orchestration sessions: start, status, cancel and inbound callbacks.
 */
@Slf4j
@Service
public class OrchestrationSessionService {

  static final String CALLBACK_SOURCE = "webhook";

  private final SessionJournal journal;
  private final SessionRepository repository;
  private final SessionOrchestrator orchestrator;
  private final OrchestrationConfigService configService;
  private final Scheduler orchestrationScheduler;
  private final HmacSigner callbackVerifier;

  private final Map<String, RunningSession> running = new ConcurrentHashMap<>();

  public OrchestrationSessionService(SessionJournal journal, SessionRepository repository,
    SessionOrchestrator orchestrator, OrchestrationConfigService configService,
    @Qualifier("orchestrationScheduler") Scheduler orchestrationScheduler,
    OrchestratorProperties properties) {
    this.journal = journal;
    this.repository = repository;
    this.orchestrator = orchestrator;
    this.configService = configService;
    this.orchestrationScheduler = orchestrationScheduler;
    String secret = properties.getCallback().getSecret();
    this.callbackVerifier = StringUtils.hasText(secret) ? new HmacSigner(secret) : null;
  }

  /**
   * Create a session in RUNNING and schedule its orchestration in the background
   *
   * @throws MalformedRequestException for a blank prompt, an unknown mode or invalid options
   */
  public SessionMeta start(String prompt, String mode, Map<String, Object> options) {
    if (!StringUtils.hasText(prompt)) {
      throw new MalformedRequestException("prompt is required");
    }
    OrchestrationConfig config = configService.resolve(options);

    SessionMeta meta = new SessionMeta();
    meta.setId(UUID.randomUUID().toString());
    meta.setPrompt(prompt);
    meta.setMode(resolveMode(mode, config));
    meta.setConfig(config);
    meta = journal.create(meta, "Session created");
    log.info("Created session: id={}, mode={}", meta.getId(), meta.getMode().value());

    launch(meta.getId());
    return meta;
  }

  public SessionStatusView status(String sessionId) {
    SessionMeta meta = repository.requireMeta(sessionId);
    return new SessionStatusView(meta, repository.loadEvents(sessionId).getEvents());
  }

  /**
   * 取消会话：状态置为 CANCELLED 后翻转取消令牌并中断后台编排
   *
   * @throws InvalidSessionTransitionException 会话已处于终态
   */
  public SessionMeta cancel(String sessionId) {
    SessionMeta meta = journal.transition(sessionId, SessionTrigger.CANCEL, m -> {
    }, EventLevel.INFO, "Cancelled by user", null);

    RunningSession session = running.remove(sessionId);
    if (session != null) {
      session.token.cancel();
      if (session.subscription != null) {
        session.subscription.dispose();
      }
    }
    log.info("Cancelled session: id={}", sessionId);
    return meta;
  }

  /**
   * 接收外部工作流回调。签名校验失败在任何状态修改之前拒绝
   *
   * @throws CallbackRejectedException 未配置密钥或签名不匹配
   * @throws MalformedRequestException 请求体不是合法 JSON
   */
  public SessionMeta callback(String sessionId, byte[] body, Charset charset, String signature) {
    repository.requireMeta(sessionId);
    if (callbackVerifier == null) {
      log.warn("Rejected callback for session {}: no callback secret configured", sessionId);
      throw new CallbackRejectedException("Callbacks are disabled");
    }
    if (!callbackVerifier.verify(body, signature)) {
      log.warn("Rejected callback for session {}: invalid signature", sessionId);
      throw new CallbackRejectedException("Invalid signature");
    }

    Object payload = parsePayload(body, charset != null ? charset : StandardCharsets.UTF_8);
    return journal.update(sessionId,
      m -> m.getCallbacks().add(new InboundCallback(CALLBACK_SOURCE, journal.now(), payload)),
      EventLevel.INFO, "Callback received", payload);
  }

  public boolean isRunning(String sessionId) {
    return running.containsKey(sessionId);
  }

  private void launch(String sessionId) {
    CancellationToken token = new CancellationToken();
    RunningSession session = new RunningSession(token);
    running.put(sessionId, session);
    session.subscription = Mono.fromRunnable(() -> runOrchestration(sessionId, token))
      .subscribeOn(orchestrationScheduler)
      .doFinally(signal -> running.remove(sessionId, session))
      .subscribe(v -> {
        }, e -> log.error("Orchestration task for session {} terminated abnormally", sessionId, e));
  }

  private void runOrchestration(String sessionId, CancellationToken token) {
    try {
      orchestrator.orchestrate(sessionId, token);
    } catch (OrchestrationCancelledException e) {
      log.info("Orchestration stopped for session {}: {}", sessionId, e.getMessage());
    } catch (Exception e) {
      if (token.isCancelled()) {
        log.info("Orchestration for cancelled session {} ended with {}", sessionId,
          e.getClass().getSimpleName());
        return;
      }
      fail(sessionId, e);
    }
  }

  private void fail(String sessionId, Exception error) {
    String message = error.getMessage() != null ? error.getMessage() : error.toString();
    log.error("Orchestration failed for session {}: {}", sessionId, message, error);
    try {
      journal.transition(sessionId, SessionTrigger.FAIL, m -> m.setError(message),
        EventLevel.ERROR, "Orchestration failed", Map.of("error", message));
    } catch (InvalidSessionTransitionException e) {
      journal.record(sessionId, EventLevel.ERROR, "Orchestration failed",
        Map.of("error", message));
      log.warn("Session {} already left running, status not changed", sessionId);
    }
  }

  private static OrchestrationMode resolveMode(String mode, OrchestrationConfig config) {
    String requested = StringUtils.hasText(mode) ? mode : config.getOrchestration().getMode();
    try {
      return OrchestrationMode.from(requested);
    } catch (IllegalArgumentException e) {
      throw new MalformedRequestException("Unknown mode: " + requested, e);
    }
  }

  /**
   * 用请求声明的字符集解码已验签的字节
   */
  private static Object parsePayload(byte[] body, Charset charset) {
    String text = body != null ? new String(body, charset) : null;
    if (!StringUtils.hasText(text)) {
      throw new MalformedRequestException("Callback body is required");
    }
    try {
      JsonNode node = JsonUtils.readTree(text);
      return JsonUtils.objectMapper().convertValue(node, Object.class);
    } catch (RuntimeException e) {
      throw new MalformedRequestException("Callback body is not valid JSON", e);
    }
  }

  private static final class RunningSession {

    private final CancellationToken token;
    private volatile Disposable subscription;

    private RunningSession(CancellationToken token) {
      this.token = token;
    }
  }
}
