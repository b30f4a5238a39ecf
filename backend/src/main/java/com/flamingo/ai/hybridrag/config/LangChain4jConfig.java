package com.flamingo.ai.hybridrag.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>The chat model is only registered when an OpenAI key is configured; without it the pipeline
 * runs with pattern extraction, keyword routing and non-generative answers. Embeddings fall back
 * to the in-process all-MiniLM-L6-v2 model.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  private static final String API_KEY_PRESENT = "!'${langchain4j.openai.api-key:}'.isBlank()";
  private static final String API_KEY_ABSENT = "'${langchain4j.openai.api-key:}'.isBlank()";

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.temperature:0.0}")
  private double temperature;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:1024}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:384}")
  private int embeddingDimensions;

  @Bean
  @ConditionalOnExpression(API_KEY_PRESENT)
  public ChatModel chatModel() {
    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .baseUrl(baseUrl)
        .modelName(chatModelName)
        .temperature(temperature)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(Duration.ofSeconds(60))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  @ConditionalOnExpression(API_KEY_PRESENT)
  public EmbeddingModel openAiEmbeddingModel() {
    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .baseUrl(baseUrl)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  @Bean
  @ConditionalOnExpression(API_KEY_ABSENT)
  public EmbeddingModel localEmbeddingModel() {
    log.info("No OpenAI API key configured, using in-process all-MiniLM-L6-v2 embeddings");
    return new AllMiniLmL6V2EmbeddingModel();
  }
}
