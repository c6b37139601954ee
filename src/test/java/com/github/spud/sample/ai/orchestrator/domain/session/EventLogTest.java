package com.github.spud.sample.ai.orchestrator.domain.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.ai.orchestrator.infrastructure.util.JsonUtils;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventLogTest {

  @Test
  void keepsMostRecentHundredInOrder() {
    EventLog log = new EventLog();
    for (int i = 1; i <= 150; i++) {
      log.append(EventLevel.INFO, "event " + i, null, i);
    }

    assertThat(log.getEvents()).hasSize(EventLog.CAPACITY);
    assertThat(log.getEvents().get(0).getMessage()).isEqualTo("event 51");
    assertThat(log.getEvents().get(99).getMessage()).isEqualTo("event 150");
    assertThat(log.getEvents()).extracting(SessionEvent::getSeq)
      .isSorted()
      .doesNotHaveDuplicates();
  }

  @Test
  void sequenceKeepsCountingAfterEviction() {
    EventLog log = new EventLog();
    for (int i = 0; i < 120; i++) {
      log.append(EventLevel.INFO, "e", null, 0);
    }

    assertThat(log.getNextSeq()).isEqualTo(121);
    assertThat(log.after(115)).extracting(SessionEvent::getSeq)
      .containsExactly(116L, 117L, 118L, 119L, 120L);
    assertThat(log.after(0)).hasSize(100);
  }

  @Test
  void survivesJsonRoundTrip() {
    EventLog log = new EventLog();
    log.append(EventLevel.WARN, "careful", Map.of("score", 0.5), 42L);

    EventLog restored = JsonUtils.fromJson(JsonUtils.toJson(log), EventLog.class);

    assertThat(restored.getNextSeq()).isEqualTo(2);
    SessionEvent event = restored.getEvents().get(0);
    assertThat(event.getLevel()).isEqualTo(EventLevel.WARN);
    assertThat(event.getTime()).isEqualTo(42L);
    assertThat(event.getData()).isEqualTo(Map.of("score", 0.5));
    assertThat(JsonUtils.toJson(event)).contains("\"level\":\"warn\"");
  }
}
