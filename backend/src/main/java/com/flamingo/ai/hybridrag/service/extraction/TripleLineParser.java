package com.flamingo.ai.hybridrag.service.extraction;

import com.flamingo.ai.hybridrag.domain.model.Triple;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Parses generator output lines of the form {@code (entity1, relation, entity2)}. */
@Component
@Slf4j
public class TripleLineParser {

  private static final Pattern TRIPLE_LINE =
      Pattern.compile("\\(([^,()]+),\\s*([^,()]+),\\s*([^()]+)\\)");

  /**
   * Parses every line of the reply; lines without a well-formed triple are skipped.
   *
   * @param reply raw generator output
   * @return parsed triples in reply order
   */
  public List<Triple> parse(String reply) {
    if (reply == null || reply.isBlank()) {
      return List.of();
    }
    List<Triple> triples = new ArrayList<>();
    for (String line : reply.split("\\R")) {
      Matcher matcher = TRIPLE_LINE.matcher(line);
      if (!matcher.find()) {
        if (!line.isBlank()) {
          log.debug("Skipping malformed triple line: {}", line);
        }
        continue;
      }
      Optional<Triple> triple = Triple.of(matcher.group(1), matcher.group(2), matcher.group(3));
      if (triple.isPresent()) {
        triples.add(triple.get());
      } else {
        log.debug("Skipping triple with empty part: {}", line);
      }
    }
    return triples;
  }
}
