package com.github.spud.sample.ai.orchestrator.domain.session;

import com.github.spud.sample.ai.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCaller;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCallerFactory;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfigService;
import com.github.spud.sample.ai.orchestrator.domain.evaluation.ResponseEvaluator;
import com.github.spud.sample.ai.orchestrator.domain.kernel.BackoffRetry;
import com.github.spud.sample.ai.orchestrator.domain.kernel.BoundedParallelRunner;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.DualPerspectiveStage;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.IterativeRefinementStage;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.ParallelExplorationStage;
import com.github.spud.sample.ai.orchestrator.infrastructure.store.InMemoryKeyValueStore;
import java.time.Duration;
import reactor.core.scheduler.Schedulers;

/**
 * 手工装配会话组件，避免启动 Spring 上下文
 */
final class SessionTestSupport {

  final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
  final OrchestratorProperties properties = new OrchestratorProperties();
  final SessionRepository repository = new SessionRepository(store, properties);
  final SessionEventBus eventBus = new SessionEventBus();
  final SessionJournal journal = new SessionJournal(repository, new SessionLocks(), eventBus,
    new SessionStateMachineDriver());
  final OrchestrationConfigService configService = new OrchestrationConfigService(store);

  SessionTestSupport() {
    properties.getAgent().getRetry().setMaxAttempts(1);
    properties.getAgent().getRetry().setBaseDelay(Duration.ZERO);
    properties.getStream().setTickInterval(Duration.ofMinutes(1));
  }

  SessionOrchestrator orchestrator(AgentCaller agentCaller, ResponseEvaluator evaluator) {
    AgentCallerFactory factory = new AgentCallerFactory(agentCaller, new BackoffRetry(0.0),
      properties, store);
    return new SessionOrchestrator(journal, factory, evaluator,
      new ParallelExplorationStage(new BoundedParallelRunner(Schedulers.boundedElastic())),
      new IterativeRefinementStage(), new DualPerspectiveStage());
  }

  OrchestrationSessionService sessionService(AgentCaller agentCaller,
    ResponseEvaluator evaluator) {
    return new OrchestrationSessionService(journal, repository,
      orchestrator(agentCaller, evaluator), configService, Schedulers.boundedElastic(),
      properties);
  }

  SessionStreamService streamService() {
    return new SessionStreamService(repository, eventBus, properties);
  }
}
