package com.github.spud.sample.ai.orchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * 全局 CORS 配置，浏览器端可直接调用会话与代理接口
 */
@Configuration
public class WebCorsConfig implements WebFluxConfigurer {

  @Value("${cors.allowed-origin-patterns:*}")
  private String[] allowedOriginPatterns;

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry.addMapping("/**")
        .allowedOriginPatterns(allowedOriginPatterns)
        .allowedMethods("GET", "POST", "PUT", "OPTIONS")
        .allowedHeaders("*")
        .exposedHeaders("X-Cache")
        .maxAge(3600);
  }
}
