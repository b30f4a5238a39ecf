package com.flamingo.ai.hybridrag.domain.model;

import java.util.List;

/**
 * Answer text plus its provenance. Evidence is empty when nothing matched.
 *
 * @param text answer text, never blank
 * @param evidence provenance entries
 * @param generated whether the text came from the generator rather than a fixed template
 */
public record ComposedAnswer(String text, List<Evidence> evidence, boolean generated) {

  public ComposedAnswer {
    evidence = List.copyOf(evidence);
  }

  public static ComposedAnswer withoutEvidence(String text) {
    return new ComposedAnswer(text, List.of(), false);
  }
}
