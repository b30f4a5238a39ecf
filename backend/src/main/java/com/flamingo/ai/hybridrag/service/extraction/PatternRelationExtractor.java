package com.flamingo.ai.hybridrag.service.extraction;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.model.Triple;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Template-based extractor. Each template has the shape {@code <word> <verb form> <word>} and
 * maps a verb family to a canonical predicate; templates are applied in order and every match
 * becomes a triple.
 */
@Component
@Slf4j
public class PatternRelationExtractor implements RelationExtractor {

  static final String RELATES_TO = "RELATES_TO";

  private static final List<Template> CANONICAL_TEMPLATES =
      List.of(
          template("is|are", "(?:(?:a|an)\\s+)?", "IS_A"),
          template("has|have", "", "HAS"),
          template("uses|use", "", "USES"),
          template("provides|provide", "", "PROVIDES"),
          template("includes|include", "", "INCLUDES"),
          template("supports|support", "", "SUPPORTS"));

  private final List<Template> templates;
  private final int minEntityLength;
  private final MeterRegistry meterRegistry;

  @Autowired
  public PatternRelationExtractor(RagConfig ragConfig, MeterRegistry meterRegistry) {
    this(ragConfig.getExtraction(), meterRegistry);
  }

  @VisibleForTesting
  PatternRelationExtractor(RagConfig.Extraction config, MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.minEntityLength = config.getMinEntityLength();
    List<Template> all = new ArrayList<>(CANONICAL_TEMPLATES);
    for (String family : config.getExtraVerbs()) {
      if (family != null && !family.isBlank()) {
        all.add(template(family.strip(), "", RELATES_TO));
      }
    }
    this.templates = List.copyOf(all);
  }

  @Override
  public List<Triple> extract(String chunkText) {
    if (chunkText == null || chunkText.isBlank()) {
      return List.of();
    }
    try {
      List<Triple> triples = new ArrayList<>();
      for (Template template : templates) {
        Matcher matcher = template.pattern().matcher(chunkText);
        while (matcher.find()) {
          String subject = matcher.group(1);
          String object = matcher.group(2);
          if (subject.length() < minEntityLength || object.length() < minEntityLength) {
            log.debug(
                "Skipping short entity in ({}, {}, {})", subject, template.predicate(), object);
            continue;
          }
          Triple.of(subject, template.predicate(), object).ifPresent(triples::add);
        }
      }
      return triples;
    } catch (RuntimeException e) {
      log.warn("Pattern extraction failed: {}", e.getMessage());
      meterRegistry.counter("extraction.failure", "strategy", "pattern").increment();
      return List.of();
    }
  }

  @Override
  public boolean supports(ExtractionStrategy strategy) {
    return strategy == ExtractionStrategy.PATTERN;
  }

  private static Template template(String verbForms, String qualifier, String predicate) {
    Pattern pattern =
        Pattern.compile(
            "\\b(\\w+)\\s+(?:" + verbForms + ")\\s+" + qualifier + "(\\w+)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    return new Template(pattern, predicate);
  }

  private record Template(Pattern pattern, String predicate) {}
}
