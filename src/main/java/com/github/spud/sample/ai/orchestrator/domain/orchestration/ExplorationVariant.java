package com.github.spud.sample.ai.orchestrator.domain.orchestration;

import com.github.spud.sample.ai.orchestrator.domain.agent.AgentProfile;
import lombok.Value;

/**
 * A named prompt/agent-profile combination explored concurrently
 */
@Value
public class ExplorationVariant {

  String name;
  String prompt;
  AgentProfile profile;
}
