package com.flamingo.ai.hybridrag.service.ingestion;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.model.Chunk;
import com.flamingo.ai.hybridrag.domain.model.IngestionReport;
import com.flamingo.ai.hybridrag.domain.model.Triple;
import com.flamingo.ai.hybridrag.exception.DocumentNotFoundException;
import com.flamingo.ai.hybridrag.service.chunking.TextChunkerRouter;
import com.flamingo.ai.hybridrag.service.extraction.RelationExtractor;
import com.flamingo.ai.hybridrag.service.extraction.RelationExtractorRouter;
import com.flamingo.ai.hybridrag.store.RelationshipIndex;
import com.flamingo.ai.hybridrag.store.SemanticIndex;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one full batch ingestion: load, chunk, index every chunk and mine its triples, then merge
 * the triples into the relationship index.
 *
 * <p>A missing document or a store failure ends the run with an error report. Chunks already
 * written to the semantic index stay there.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

  private final DocumentLoader documentLoader;
  private final TextChunkerRouter textChunkerRouter;
  private final RelationExtractorRouter relationExtractorRouter;
  private final SemanticIndex semanticIndex;
  private final RelationshipIndex relationshipIndex;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Ingests the referenced document, or the configured default document when none is given.
   *
   * @param documentRef file path or resource URL, may be {@code null}
   * @return the run's report; never {@code null}
   */
  @Timed(value = "rag.ingest", description = "Time to ingest a document")
  public IngestionReport ingest(String documentRef) {
    String ref =
        documentRef == null || documentRef.isBlank()
            ? ragConfig.getIngestion().getDefaultDocument()
            : documentRef.strip();
    log.info("Starting ingestion of {}", ref);

    String text;
    try {
      text = documentLoader.load(ref);
    } catch (DocumentNotFoundException e) {
      log.error("Ingestion of {} failed: {}", ref, e.getMessage());
      return failure(0, 0, e.getMessage());
    }

    int chunksWritten = 0;
    List<Triple> triples = new ArrayList<>();
    try {
      RagConfig.Chunking chunking = ragConfig.getChunking();
      List<Chunk> chunks =
          textChunkerRouter.route(chunking.getStrategy()).chunk(text, ref, chunking);
      if (chunks.isEmpty()) {
        log.info("No chunks produced for {}", ref);
        meterRegistry.counter("ingestion.success").increment();
        return IngestionReport.success(0, 0);
      }

      RelationExtractor extractor =
          relationExtractorRouter.route(ragConfig.getExtraction().getStrategy());
      for (Chunk chunk : chunks) {
        semanticIndex.add(chunk.id(), chunk.text(), chunk.metadata().asMap());
        chunksWritten++;
        List<Triple> extracted = extractor.extract(chunk.text());
        triples.addAll(extracted);
        log.debug(
            "Chunk {}/{}: {} triples",
            chunk.metadata().sequenceIndex() + 1,
            chunks.size(),
            extracted.size());
      }
      semanticIndex.refresh();

      for (Triple triple : triples) {
        relationshipIndex.mergeNode(triple.subject());
        relationshipIndex.mergeNode(triple.object());
        relationshipIndex.mergeEdge(triple.subject(), triple.predicate(), triple.object());
      }
    } catch (RuntimeException e) {
      log.error(
          "Ingestion of {} aborted after {} chunks; semantic index writes are not rolled back",
          ref,
          chunksWritten,
          e);
      return failure(chunksWritten, triples.size(), e.getMessage());
    }

    log.info("Ingested {}: {} chunks, {} triples", ref, chunksWritten, triples.size());
    meterRegistry.counter("ingestion.success").increment();
    return IngestionReport.success(chunksWritten, triples.size());
  }

  private IngestionReport failure(int chunksWritten, int triplesExtracted, String reason) {
    meterRegistry.counter("ingestion.failure").increment();
    return IngestionReport.error(chunksWritten, triplesExtracted, reason);
  }
}
