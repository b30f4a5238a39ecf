package com.flamingo.ai.hybridrag.service.llm;

import com.flamingo.ai.hybridrag.agent.GroundedAnswerAgent;
import com.flamingo.ai.hybridrag.agent.QueryRoutingAgent;
import com.flamingo.ai.hybridrag.agent.TripleExtractionAgent;
import com.flamingo.ai.hybridrag.exception.LlmServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * {@link TextGenerator} backed by the LangChain4j AI Services agents. The agents are optional
 * beans; without them every call fails fast with {@link LlmServiceException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentTextGenerator implements TextGenerator {

  private final ObjectProvider<TripleExtractionAgent> tripleExtractionAgent;
  private final ObjectProvider<QueryRoutingAgent> queryRoutingAgent;
  private final ObjectProvider<GroundedAnswerAgent> groundedAnswerAgent;
  private final MeterRegistry meterRegistry;

  @Override
  public boolean isAvailable() {
    return groundedAnswerAgent.getIfAvailable() != null;
  }

  @Override
  @Timed(value = "generator.extract_triples", description = "Time to extract triples")
  @CircuitBreaker(name = "llm", fallbackMethod = "singleArgFallback")
  @Retry(name = "llm")
  public String extractTriples(String chunkText) {
    TripleExtractionAgent agent = require(tripleExtractionAgent);
    return complete("extract_triples", () -> agent.extractTriples(chunkText));
  }

  @Override
  @Timed(value = "generator.choose_route", description = "Time to choose a route")
  @CircuitBreaker(name = "llm", fallbackMethod = "singleArgFallback")
  @Retry(name = "llm")
  public String chooseRoute(String question) {
    QueryRoutingAgent agent = require(queryRoutingAgent);
    return complete("choose_route", () -> agent.chooseRoute(question));
  }

  @Override
  @Timed(value = "generator.answer", description = "Time to generate an answer")
  @CircuitBreaker(name = "llm", fallbackMethod = "twoArgFallback")
  @Retry(name = "llm")
  public String answerFromPassages(String context, String question) {
    GroundedAnswerAgent agent = require(groundedAnswerAgent);
    return complete("answer_passages", () -> agent.answerFromPassages(context, question));
  }

  @Override
  @Timed(value = "generator.answer", description = "Time to generate an answer")
  @CircuitBreaker(name = "llm", fallbackMethod = "twoArgFallback")
  @Retry(name = "llm")
  public String answerFromFacts(String facts, String question) {
    GroundedAnswerAgent agent = require(groundedAnswerAgent);
    return complete("answer_facts", () -> agent.answerFromFacts(facts, question));
  }

  private <T> T require(ObjectProvider<T> provider) {
    T agent = provider.getIfAvailable();
    if (agent == null) {
      throw new LlmServiceException("No chat model configured");
    }
    return agent;
  }

  private String complete(String operation, Supplier<String> call) {
    String response = call.get();
    if (response == null || response.isBlank()) {
      throw new LlmServiceException("Chat model returned an empty response for " + operation);
    }
    meterRegistry.counter("generator.requests.success", "operation", operation).increment();
    return response.strip();
  }

  @SuppressWarnings("unused")
  private String singleArgFallback(String input, Throwable t) {
    throw toLlmServiceException(t);
  }

  @SuppressWarnings("unused")
  private String twoArgFallback(String first, String second, Throwable t) {
    throw toLlmServiceException(t);
  }

  private LlmServiceException toLlmServiceException(Throwable t) {
    log.warn("Text generation failed: {}", t.getMessage());
    meterRegistry.counter("generator.requests.failure").increment();
    if (t instanceof LlmServiceException llmServiceException) {
      return llmServiceException;
    }
    return new LlmServiceException("Text generation failed: " + t.getMessage(), t);
  }
}
