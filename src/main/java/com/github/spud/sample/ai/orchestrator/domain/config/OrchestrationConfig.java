package com.github.spud.sample.ai.orchestrator.domain.config;

import com.github.spud.sample.ai.orchestrator.domain.agent.AgentProfile;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 编排配置文档
 * <p>
 * 字段初始值即内置默认层；持久化覆盖层和请求覆盖层按 {@link ConfigLayering} 依次深度合并。
 */
@Data
public class OrchestrationConfig {

  public static final String DEFAULT_AGENT = "draft";
  public static final String POLISH_AGENT = "polish";
  public static final String CRITIC_AGENT = "critic";
  public static final String CREATIVE_AGENT = "creative";

  private Orchestration orchestration = new Orchestration();

  private Quality quality = new Quality();

  private Testing testing = new Testing();

  private Map<String, AgentProfile> agents = defaultAgents();

  private Caching caching = new Caching();

  private Budget budget = new Budget();

  private List<VariantSpec> variants = defaultVariants();

  @Data
  public static class Orchestration {

    /**
     * 并行探索的并发度
     */
    private int parallelConcurrency = 3;

    /**
     * 迭代精炼的最大尝试次数
     */
    private int maxIterations = 3;

    private String iterationStrategy = "feedback";

    /**
     * 是否允许 reflect 模式（生成-评审-综合）
     */
    private boolean enableReflectCritic = true;

    private String mode;
  }

  @Data
  public static class Quality {

    /**
     * 低于该分数进入迭代精炼
     */
    private double threshold = 0.85;

    private double passThreshold = 0.85;

    private ScoreWeights scoreWeights = new ScoreWeights();
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ScoreWeights {

    private double correctness = 0.4;
    private double performance = 0.3;
    private double style = 0.3;
  }

  @Data
  public static class Testing {

    private boolean enableQuickTests = true;

    /**
     * 快速测试 webhook 超时（毫秒）
     */
    private long quickTestTimeout = 5000;
  }

  @Data
  public static class Caching {

    public static final long DEFAULT_TTL = 86400;

    private boolean enabled = false;

    /**
     * 缓存 TTL（秒）
     */
    private long ttl = DEFAULT_TTL;
  }

  @Data
  public static class Budget {

    private int maxTokensPerRequest = 4000;
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class VariantSpec {

    private String name;

    /**
     * 追加在原始 prompt 之后的指令
     */
    private String modifier;

    /**
     * agents 中的 profile 名称
     */
    private String agentConfig;
  }

  /**
   * 按名称解析 agent profile，找不到时退回 draft
   */
  public AgentProfile agentProfile(String name) {
    AgentProfile profile = name != null ? agents.get(name) : null;
    if (profile == null) {
      profile = agents.get(DEFAULT_AGENT);
    }
    if (profile == null) {
      profile = new AgentProfile();
    }
    if (profile.getMaxTokens() == null && budget != null) {
      profile = profile.toBuilder().maxTokens(budget.getMaxTokensPerRequest()).build();
    }
    return profile;
  }

  private static Map<String, AgentProfile> defaultAgents() {
    Map<String, AgentProfile> agents = new LinkedHashMap<>();
    agents.put(DEFAULT_AGENT, AgentProfile.of("fast-small", 0.7));
    agents.put(POLISH_AGENT, AgentProfile.of("fast-precise", 0.3));
    agents.put(CRITIC_AGENT, AgentProfile.of("fast-medium", 0.5));
    agents.put(CREATIVE_AGENT, AgentProfile.of("fast-medium", 0.9));
    return agents;
  }

  private static List<VariantSpec> defaultVariants() {
    List<VariantSpec> variants = new ArrayList<>();
    variants.add(new VariantSpec("default", "", DEFAULT_AGENT));
    variants.add(new VariantSpec("creative",
      "Be creative and innovative. Think outside the box.", CREATIVE_AGENT));
    variants.add(new VariantSpec("robust",
      "Focus on correctness, edge cases, and defensive programming.", DEFAULT_AGENT));
    variants.add(new VariantSpec("efficient",
      "Optimize for performance and resource efficiency.", DEFAULT_AGENT));
    return variants;
  }
}
