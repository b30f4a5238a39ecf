package com.flamingo.ai.hybridrag.config;

import com.flamingo.ai.hybridrag.agent.GroundedAnswerAgent;
import com.flamingo.ai.hybridrag.agent.QueryRoutingAgent;
import com.flamingo.ai.hybridrag.agent.TripleExtractionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j AI Services used by the generative strategies.
 *
 * <p>Agents exist only alongside the chat model, i.e. when an OpenAI key is configured.
 */
@Configuration
@ConditionalOnExpression("!'${langchain4j.openai.api-key:}'.isBlank()")
public class AiAgentConfig {

  @Bean
  public TripleExtractionAgent tripleExtractionAgent(ChatModel chatModel) {
    return AiServices.builder(TripleExtractionAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public QueryRoutingAgent queryRoutingAgent(ChatModel chatModel) {
    return AiServices.builder(QueryRoutingAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public GroundedAnswerAgent groundedAnswerAgent(ChatModel chatModel) {
    return AiServices.builder(GroundedAnswerAgent.class).chatModel(chatModel).build();
  }
}
