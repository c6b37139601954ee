package com.github.spud.sample.ai.orchestrator.interfaces.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCaller;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentResponse;
import com.github.spud.sample.ai.orchestrator.infrastructure.security.HmacSigner;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient(timeout = "10s")
@ActiveProfiles("test")
class OrchestrationSessionControllerTest {

  private static final String SLOW_MARKER = "[slow]";

  private static final HmacSigner SIGNER = new HmacSigner("test-callback-secret");

  @TestConfiguration
  static class FakeAgentConfig {

    /**
     * 不访问模型供应商；带 [slow] 标记的 prompt 一直阻塞到会话被取消
     */
    @Bean
    @Primary
    AgentCaller fakeAgentCaller() {
      return (request, token) -> {
        if (request.getPrompt().contains(SLOW_MARKER)) {
          while (!token.isCancelled()) {
            try {
              Thread.sleep(20);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
              break;
            }
          }
          token.throwIfCancelled();
        }
        return AgentResponse.of("def solve():\n  # answer\n  return 42");
      };
    }
  }

  @Autowired
  private WebTestClient webTestClient;

  private String startSession(String prompt) {
    JsonNode body = webTestClient.post().uri("/session/start")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(Map.of("prompt", prompt, "mode", "fast",
        "options", Map.of("quality", Map.of("threshold", 0.1))))
      .exchange()
      .expectStatus().isOk()
      .expectBody(JsonNode.class)
      .returnResult().getResponseBody();
    assertThat(body).isNotNull();
    String id = body.get("id").asText();
    assertThat(body.get("sessionUrl").asText()).isEqualTo("/session/" + id);
    return id;
  }

  private JsonNode status(String id) {
    return webTestClient.get().uri("/session/{id}/status", id)
      .exchange()
      .expectStatus().isOk()
      .expectBody(JsonNode.class)
      .returnResult().getResponseBody();
  }

  @Test
  void startedSessionRunsToSuccess() {
    String id = startSession("write a solver");

    await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
      assertThat(status(id).at("/meta/status").asText()).isEqualTo("succeeded"));

    JsonNode view = status(id);
    assertThat(view.at("/meta/mode").asText()).isEqualTo("fast");
    assertThat(view.at("/meta/outcome/ok").asBoolean()).isTrue();
    assertThat(view.at("/meta/outcome/source").asText()).isEqualTo("exploration");
    assertThat(view.at("/events/0/message").asText()).isEqualTo("Session created");
    assertThat(view.at("/events/0/seq").asLong()).isEqualTo(1);

    webTestClient.get().uri("/session/{id}", id)
      .exchange()
      .expectStatus().isOk()
      .expectBody().jsonPath("$.meta.id").isEqualTo(id);
  }

  @Test
  void streamEndsWithCompleteFrame() {
    String id = startSession("stream me");
    await().atMost(Duration.ofSeconds(10)).untilAsserted(() ->
      assertThat(status(id).at("/meta/status").asText()).isEqualTo("succeeded"));

    List<ServerSentEvent<JsonNode>> frames = webTestClient.get().uri("/session/{id}/stream", id)
      .accept(MediaType.TEXT_EVENT_STREAM)
      .exchange()
      .expectStatus().isOk()
      .returnResult(new ParameterizedTypeReference<ServerSentEvent<JsonNode>>() {
      })
      .getResponseBody()
      .collectList()
      .block(Duration.ofSeconds(10));

    assertThat(frames).isNotEmpty();
    ServerSentEvent<JsonNode> first = frames.get(0);
    assertThat(first.id()).isEqualTo("1");
    assertThat(first.data().get("type").asText()).isEqualTo("event");
    JsonNode last = frames.get(frames.size() - 1).data();
    assertThat(last.get("type").asText()).isEqualTo("complete");
    assertThat(last.get("status").asText()).isEqualTo("succeeded");
  }

  @Test
  void blankPromptIsValidationError() {
    webTestClient.post().uri("/session/start")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(Map.of("prompt", ""))
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody()
      .jsonPath("$.code").isEqualTo("VALIDATION_ERROR")
      .jsonPath("$.details.fieldErrors.prompt").isEqualTo("prompt is required");
  }

  @Test
  void unknownModeIsInvalidRequest() {
    webTestClient.post().uri("/session/start")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(Map.of("prompt", "x", "mode", "turbo"))
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody().jsonPath("$.code").isEqualTo("INVALID_REQUEST");
  }

  @Test
  void unknownSessionIsNotFound() {
    webTestClient.get().uri("/session/{id}/status", "missing")
      .exchange()
      .expectStatus().isNotFound()
      .expectBody().jsonPath("$.code").isEqualTo("SESSION_NOT_FOUND");
  }

  @Test
  void cancelRunningSessionThenConflict() {
    String id = startSession("long task " + SLOW_MARKER);

    webTestClient.post().uri("/session/{id}/cancel", id)
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.id").isEqualTo(id)
      .jsonPath("$.status").isEqualTo("cancelled");

    webTestClient.post().uri("/session/{id}/cancel", id)
      .exchange()
      .expectStatus().isEqualTo(409)
      .expectBody()
      .jsonPath("$.code").isEqualTo("INVALID_SESSION_STATE")
      .jsonPath("$.details.status").isEqualTo("cancelled");

    assertThat(status(id).at("/meta/status").asText()).isEqualTo("cancelled");
  }

  @Test
  void callbackRequiresValidSignature() {
    String id = startSession("await callback " + SLOW_MARKER);
    String body = "{\"step\":\"build\",\"ok\":true}";

    webTestClient.post().uri("/session/{id}/callback", id)
      .contentType(MediaType.APPLICATION_JSON)
      .header("X-Signature", "forged")
      .bodyValue(body)
      .exchange()
      .expectStatus().isForbidden()
      .expectBody().jsonPath("$.code").isEqualTo("CALLBACK_REJECTED");

    webTestClient.post().uri("/session/{id}/callback", id)
      .contentType(MediaType.APPLICATION_JSON)
      .header("X-Signature", SIGNER.sign(body.getBytes(StandardCharsets.UTF_8)))
      .bodyValue(body)
      .exchange()
      .expectStatus().isOk()
      .expectBody().jsonPath("$.status").isEqualTo("ok");

    JsonNode view = status(id);
    assertThat(view.at("/meta/callbacks/0/source").asText()).isEqualTo("webhook");
    assertThat(view.at("/meta/callbacks/0/payload/step").asText()).isEqualTo("build");

    webTestClient.post().uri("/session/{id}/cancel", id).exchange().expectStatus().isOk();
  }

  @Test
  void callbackSignatureCoversRawBytesInDeclaredCharset() {
    String id = startSession("latin-1 callback " + SLOW_MARKER);
    byte[] body = "{\"note\":\"café\"}".getBytes(StandardCharsets.ISO_8859_1);

    webTestClient.post().uri("/session/{id}/callback", id)
      .contentType(MediaType.parseMediaType("application/json;charset=ISO-8859-1"))
      .header("X-Signature", SIGNER.sign(body))
      .bodyValue(body)
      .exchange()
      .expectStatus().isOk();

    assertThat(status(id).at("/meta/callbacks/0/payload/note").asText()).isEqualTo("café");

    webTestClient.post().uri("/session/{id}/cancel", id).exchange().expectStatus().isOk();
  }

  @Test
  void proxyCachesRepeatedPrompt() {
    Map<String, String> request = Map.of("prompt", "proxy prompt " + System.nanoTime());

    webTestClient.post().uri("/proxy")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(request)
      .exchange()
      .expectStatus().isOk()
      .expectHeader().valueEquals("X-Cache", "MISS")
      .expectBody().jsonPath("$.text").isEqualTo("def solve():\n  # answer\n  return 42");

    webTestClient.post().uri("/proxy")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(request)
      .exchange()
      .expectStatus().isOk()
      .expectHeader().valueEquals("X-Cache", "HIT")
      .expectBody().jsonPath("$.text").isEqualTo("def solve():\n  # answer\n  return 42");
  }

  @Test
  void proxyWithoutPromptIsValidationError() {
    webTestClient.post().uri("/proxy")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(Map.of())
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody()
      .jsonPath("$.code").isEqualTo("VALIDATION_ERROR")
      .jsonPath("$.details.fieldErrors.prompt").isEqualTo("Missing prompt");
  }

  @Test
  void crossOriginRequestsAreAllowed() {
    webTestClient.options().uri("/proxy")
      .header("Origin", "http://example.com")
      .header("Access-Control-Request-Method", "POST")
      .header("Access-Control-Request-Headers", "Content-Type")
      .exchange()
      .expectStatus().isOk()
      .expectHeader().valueEquals("Access-Control-Allow-Origin", "http://example.com")
      .expectHeader().value("Access-Control-Allow-Methods",
        methods -> assertThat(methods).contains("POST"));

    webTestClient.post().uri("/proxy")
      .header("Origin", "http://example.com")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(Map.of("prompt", "cors " + System.nanoTime()))
      .exchange()
      .expectStatus().isOk()
      .expectHeader().valueEquals("Access-Control-Expose-Headers", "X-Cache");
  }

  @Test
  void configCanBeReadAndUpdated() {
    webTestClient.get().uri("/config")
      .exchange()
      .expectStatus().isOk()
      .expectBody()
      .jsonPath("$.quality.threshold").isNumber()
      .jsonPath("$.variants[0].name").isEqualTo("default");

    webTestClient.put().uri("/config")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(Map.of("orchestration", Map.of("maxIterations", 2)))
      .exchange()
      .expectStatus().isOk()
      .expectBody().jsonPath("$.orchestration.maxIterations").isEqualTo(2);

    webTestClient.put().uri("/config")
      .contentType(MediaType.APPLICATION_JSON)
      .bodyValue(Map.of("quality", Map.of("threshold", 7)))
      .exchange()
      .expectStatus().isBadRequest()
      .expectBody().jsonPath("$.code").isEqualTo("INVALID_REQUEST");
  }

  @Test
  void healthReportsOk() {
    webTestClient.get().uri("/health")
      .exchange()
      .expectStatus().isOk()
      .expectBody().jsonPath("$.status").isEqualTo("ok");
  }
}
