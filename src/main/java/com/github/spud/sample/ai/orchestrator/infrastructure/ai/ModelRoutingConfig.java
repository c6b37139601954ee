package com.github.spud.sample.ai.orchestrator.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 模型配置 基于 Spring AI 自动装配的 ChatModel 构建 ChatClient
 */
@Slf4j
@Configuration
public class ModelRoutingConfig {

  @Value("${spring.ai.openai.base-url:https://api.openai.com}")
  private String openaiBaseUrl;

  @Bean
  public ChatClient chatClient(ChatModel chatModel) {
    log.info("Using {} as agent chat model, baseUrl={}", chatModel.getClass().getSimpleName(),
      openaiBaseUrl);
    return ChatClient.builder(chatModel).build();
  }
}
