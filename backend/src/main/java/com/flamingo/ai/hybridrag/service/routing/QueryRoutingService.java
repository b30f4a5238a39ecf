package com.flamingo.ai.hybridrag.service.routing;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.model.RoutingDecision;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Applies the configured routing policy to each question. Decisions are never cached. */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryRoutingService {

  private final List<QueryRouter> routers;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.route", description = "Time to route a question")
  public RoutingDecision route(String question) {
    RoutingStrategy strategy = ragConfig.getRouting().getStrategy();
    QueryRouter router =
        routers.stream()
            .filter(r -> r.supports(strategy))
            .findFirst()
            .orElseThrow(
                () -> new IllegalStateException("No QueryRouter found for strategy: " + strategy));

    RoutingDecision decision = router.route(question);
    log.info("Routed question to {} ({} policy)", decision.getLabel(), strategy);
    meterRegistry.counter("routing.decision", "route", decision.getLabel()).increment();
    return decision;
  }
}
