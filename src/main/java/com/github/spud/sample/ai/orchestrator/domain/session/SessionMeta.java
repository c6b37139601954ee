package com.github.spud.sample.ai.orchestrator.domain.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationMode;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.DualPerspectiveResult;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.ExplorationResult;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.RefinementResult;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * 会话元数据，持久化在 session:{id}:meta
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionMeta {

  private String id;

  private String prompt;

  private OrchestrationMode mode;

  /**
   * 启动时解析出的配置快照
   */
  private OrchestrationConfig config;

  private SessionStatus status;

  private long createdAt;

  private long updatedAt;

  private List<InboundCallback> callbacks = new ArrayList<>();

  private ExplorationResult exploration;

  private DualPerspectiveResult dualPerspective;

  private RefinementResult refinement;

  private FinalOutcome outcome;

  private String error;
}
