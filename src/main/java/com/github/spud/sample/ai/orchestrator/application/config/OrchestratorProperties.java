package com.github.spud.sample.ai.orchestrator.application.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 编排服务配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.orchestrator")
public class OrchestratorProperties {

  private Store store = new Store();

  private Stream stream = new Stream();

  private Callback callback = new Callback();

  private Agent agent = new Agent();

  private QuickTest quickTest = new QuickTest();

  @Data
  public static class Store {

    /**
     * memory 或 redis
     */
    private String type = "memory";

    /**
     * 会话 meta 与事件日志的保留时长，每次写入刷新
     */
    private Duration sessionTtl = Duration.ofDays(7);
  }

  @Data
  public static class Stream {

    /**
     * 占位消息轮换与状态轮询的间隔
     */
    private Duration tickInterval = Duration.ofSeconds(1);
  }

  @Data
  public static class Callback {

    /**
     * 回调 HMAC 密钥，未配置时拒绝所有回调
     */
    private String secret;

    private String signatureHeader = "X-Signature";
  }

  @Data
  public static class Agent {

    private Retry retry = new Retry();

    /**
     * 逻辑模型名（如 fast-small）到供应商模型名的映射，未命中时原样透传
     */
    private Map<String, String> models = new LinkedHashMap<>();
  }

  @Data
  public static class Retry {

    private int maxAttempts = 3;

    private Duration baseDelay = Duration.ofSeconds(1);

    /**
     * 抖动比例，0 表示不加抖动
     */
    private double jitterRatio = 0.2;
  }

  @Data
  public static class QuickTest {

    /**
     * 快速测试 webhook 地址，为空时使用启发式打分
     */
    private String webhookUrl;

    private String secret;

    private String secretHeader = "X-Quick-Test-Secret";
  }
}
