package com.flamingo.ai.hybridrag.config;

import com.flamingo.ai.hybridrag.service.chunking.ChunkingStrategy;
import com.flamingo.ai.hybridrag.service.extraction.ExtractionStrategy;
import com.flamingo.ai.hybridrag.service.routing.RoutingStrategy;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the hybrid RAG pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Extraction extraction = new Extraction();
  private Routing routing = new Routing();
  private Retrieval retrieval = new Retrieval();
  private Ingestion ingestion = new Ingestion();
  private Store store = new Store();

  @Getter
  @Setter
  public static class Chunking {
    private ChunkingStrategy strategy = ChunkingStrategy.RECURSIVE;

    /** Window size in characters for the recursive policy. */
    private int size = 300;

    /** Characters carried over from the end of one chunk into the next. */
    private int overlap = 50;

    /**
     * Slice whitespace-free runs longer than {@link #size} into window-sized pieces instead of
     * emitting them as one oversized chunk.
     */
    private boolean hardCutOversizedWords = false;

    /** Structural policy: paragraphs shorter than this are dropped as noise. */
    private int minLength = 50;

    /** Structural policy: paragraphs longer than this are re-split by sentence. */
    private int maxParagraphLength = 500;

    /** Structural policy: upper bound for a packed group of sentences. */
    private int sentencePackLength = 400;
  }

  @Getter
  @Setter
  public static class Extraction {
    private ExtractionStrategy strategy = ExtractionStrategy.PATTERN;

    /** Captured entities shorter than this are discarded. */
    private int minEntityLength = 3;

    /**
     * Additional verb families for the pattern extractor, each written as pipe-separated forms
     * (e.g. {@code enables|enable}). Families without a canonical predicate map to RELATES_TO.
     */
    private List<String> extraVerbs = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class Routing {
    private RoutingStrategy strategy = RoutingStrategy.HEURISTIC;

    /** Checked first; any hit routes the question to the relationship index. */
    private List<String> relationalIndicators =
        new ArrayList<>(
            List.of(
                "how does",
                "relate",
                "relationship",
                "connection",
                "connected",
                "links",
                "associated",
                "depends",
                "uses",
                "has",
                "includes"));

    private List<String> semanticIndicators =
        new ArrayList<>(
            List.of(
                "what is",
                "define",
                "explain",
                "describe",
                "meaning",
                "overview",
                "summary",
                "about"));
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 3;

    /**
     * Semantic hits scoring below this relevance are ignored. Relevance is (cosine + 1) / 2, so 0.5
     * is an orthogonal passage.
     */
    private double minScore = 0.6;

    /** Also drop semantic hits that share no content word with the question. */
    private boolean requireTermOverlap = true;

    /** Maximum number of relationship facts put in front of the generator. */
    private int maxFacts = 5;

    /** Characters of context quoted by the non-generative semantic answer. */
    private int fallbackPreviewChars = 200;
  }

  @Getter
  @Setter
  public static class Ingestion {
    /** Document ingested when a request does not name one. */
    private String defaultDocument = "classpath:data/sample-corpus.txt";
  }

  /** Backend selection for the two corpus stores. */
  @Getter
  @Setter
  public static class Store {
    /** {@code in-memory} or {@code elasticsearch}. */
    private String semantic = "in-memory";

    /** {@code in-memory} or {@code neo4j}. */
    private String relationship = "in-memory";
  }
}
