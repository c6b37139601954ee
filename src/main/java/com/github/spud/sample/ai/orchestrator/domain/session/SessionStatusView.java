package com.github.spud.sample.ai.orchestrator.domain.session;

import java.util.List;
import lombok.Value;

@Value
public class SessionStatusView {

  SessionMeta meta;
  List<SessionEvent> events;
}
