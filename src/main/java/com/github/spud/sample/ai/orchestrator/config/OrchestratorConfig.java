package com.github.spud.sample.ai.orchestrator.config;

import com.github.spud.sample.ai.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.sample.ai.orchestrator.domain.kernel.BackoffRetry;
import com.github.spud.sample.ai.orchestrator.domain.kernel.BoundedParallelRunner;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.DualPerspectiveStage;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.IterativeRefinementStage;
import com.github.spud.sample.ai.orchestrator.domain.orchestration.ParallelExplorationStage;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class OrchestratorConfig {

  /**
   * 后台编排任务的调度器，每个会话占用一个线程直到结束
   */
  @Bean(name = "orchestrationScheduler", destroyMethod = "dispose")
  public Scheduler orchestrationScheduler() {
    return Schedulers.newBoundedElastic(Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
      Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "orchestration");
  }

  @Bean
  public BoundedParallelRunner boundedParallelRunner() {
    return new BoundedParallelRunner(Schedulers.boundedElastic());
  }

  @Bean
  public BackoffRetry backoffRetry(OrchestratorProperties properties) {
    return new BackoffRetry(properties.getAgent().getRetry().getJitterRatio());
  }

  @Bean
  public ParallelExplorationStage parallelExplorationStage(BoundedParallelRunner runner) {
    return new ParallelExplorationStage(runner);
  }

  @Bean
  public IterativeRefinementStage iterativeRefinementStage() {
    return new IterativeRefinementStage();
  }

  @Bean
  public DualPerspectiveStage dualPerspectiveStage() {
    return new DualPerspectiveStage();
  }
}
