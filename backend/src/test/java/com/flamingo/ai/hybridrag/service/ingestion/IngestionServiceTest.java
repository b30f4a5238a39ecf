package com.flamingo.ai.hybridrag.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.model.IngestionReport;
import com.flamingo.ai.hybridrag.domain.model.OperationStatus;
import com.flamingo.ai.hybridrag.domain.model.Triple;
import com.flamingo.ai.hybridrag.exception.DocumentNotFoundException;
import com.flamingo.ai.hybridrag.exception.SearchException;
import com.flamingo.ai.hybridrag.service.chunking.ParagraphSentenceChunker;
import com.flamingo.ai.hybridrag.service.chunking.RecursiveCharacterChunker;
import com.flamingo.ai.hybridrag.service.chunking.TextChunkerRouter;
import com.flamingo.ai.hybridrag.service.embedding.EmbeddingService;
import com.flamingo.ai.hybridrag.service.extraction.PatternRelationExtractor;
import com.flamingo.ai.hybridrag.service.extraction.RelationExtractorRouter;
import com.flamingo.ai.hybridrag.store.SemanticIndex;
import com.flamingo.ai.hybridrag.store.memory.InMemoryRelationshipIndex;
import com.flamingo.ai.hybridrag.store.memory.InMemorySemanticIndex;
import com.flamingo.ai.hybridrag.support.KeywordEmbeddingModel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionService Tests")
class IngestionServiceTest {

  @Mock private DocumentLoader documentLoader;

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private TextChunkerRouter chunkerRouter;
  private RelationExtractorRouter extractorRouter;
  private InMemorySemanticIndex semanticIndex;
  private InMemoryRelationshipIndex relationshipIndex;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    chunkerRouter =
        new TextChunkerRouter(
            List.of(new RecursiveCharacterChunker(), new ParagraphSentenceChunker()));
    extractorRouter =
        new RelationExtractorRouter(
            List.of(new PatternRelationExtractor(ragConfig, meterRegistry)));
    semanticIndex =
        new InMemorySemanticIndex(
            new EmbeddingService(new KeywordEmbeddingModel(), meterRegistry));
    relationshipIndex = new InMemoryRelationshipIndex();
  }

  private IngestionService service(SemanticIndex index) {
    return new IngestionService(
        documentLoader,
        chunkerRouter,
        extractorRouter,
        index,
        relationshipIndex,
        ragConfig,
        meterRegistry);
  }

  @Nested
  @DisplayName("Successful runs")
  class SuccessfulRuns {

    @Test
    @DisplayName("should index chunks and merge extracted triples")
    void shouldIndexChunksAndMergeTriples() {
      when(documentLoader.load("notes.txt"))
          .thenReturn("FastAPI has routers. Routers enable organization.");

      IngestionReport report = service(semanticIndex).ingest("notes.txt");

      assertThat(report.status()).isEqualTo(OperationStatus.SUCCESS);
      assertThat(report.chunksProcessed()).isEqualTo(1);
      assertThat(report.triplesExtracted()).isEqualTo(1);
      assertThat(report.message())
          .isEqualTo("Successfully ingested 1 chunks and extracted 1 triples");
      assertThat(semanticIndex.size()).isEqualTo(1);
      assertThat(relationshipIndex.nodeCount()).isEqualTo(2);
      assertThat(relationshipIndex.edgeCount()).isEqualTo(1);
      assertThat(meterRegistry.counter("ingestion.success").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should ingest the default document when no path is given")
    void shouldIngestDefaultDocument() {
      when(documentLoader.load("classpath:data/sample-corpus.txt"))
          .thenReturn("FastAPI uses Starlette.");

      IngestionReport report = service(semanticIndex).ingest("  ");

      assertThat(report.isSuccess()).isTrue();
      verify(documentLoader).load("classpath:data/sample-corpus.txt");
    }

    @Test
    @DisplayName("should append chunks when the same document is ingested twice")
    void shouldAppendOnReingestion() {
      when(documentLoader.load("notes.txt")).thenReturn("FastAPI has routers.");

      service(semanticIndex).ingest("notes.txt");
      service(semanticIndex).ingest("notes.txt");

      assertThat(semanticIndex.size()).isEqualTo(2);
      assertThat(relationshipIndex.nodeCount()).isEqualTo(2);
      assertThat(relationshipIndex.edgeCount()).isEqualTo(1);
      assertThat(relationshipIndex.match(Set.of("fastapi")))
          .containsExactly(new Triple("FastAPI", "HAS", "routers"));
    }

    @Test
    @DisplayName("should report success with zero counts for an empty document")
    void shouldReportZeroCounts_forEmptyDocument() {
      when(documentLoader.load("empty.txt")).thenReturn("   ");

      IngestionReport report = service(semanticIndex).ingest("empty.txt");

      assertThat(report.isSuccess()).isTrue();
      assertThat(report.chunksProcessed()).isZero();
      assertThat(report.triplesExtracted()).isZero();
    }
  }

  @Nested
  @DisplayName("Failed runs")
  class FailedRuns {

    @Test
    @DisplayName("should report a missing document without touching the stores")
    void shouldReportMissingDocument() {
      when(documentLoader.load("missing.txt"))
          .thenThrow(new DocumentNotFoundException("missing.txt"));

      IngestionReport report = service(semanticIndex).ingest("missing.txt");

      assertThat(report.status()).isEqualTo(OperationStatus.ERROR);
      assertThat(report.message())
          .isEqualTo("Failed to ingest data: Document not found: missing.txt");
      assertThat(report.chunksProcessed()).isZero();
      assertThat(semanticIndex.size()).isZero();
      assertThat(meterRegistry.counter("ingestion.failure").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should stop at a store failure and report the partial counts")
    void shouldReportPartialCounts_onStoreFailure() {
      ragConfig.getChunking().setSize(30);
      ragConfig.getChunking().setOverlap(0);
      when(documentLoader.load("notes.txt"))
          .thenReturn("FastAPI has routers.\n\nPydantic provides validation.");
      SemanticIndex failingIndex = mock(SemanticIndex.class);
      doNothing()
          .doThrow(new SearchException("Failed to index documents to hybrid-rag-chunks"))
          .when(failingIndex)
          .add(anyString(), anyString(), anyMap());

      IngestionReport report = service(failingIndex).ingest("notes.txt");

      assertThat(report.status()).isEqualTo(OperationStatus.ERROR);
      assertThat(report.chunksProcessed()).isEqualTo(1);
      assertThat(report.triplesExtracted()).isEqualTo(1);
      assertThat(report.message()).contains("hybrid-rag-chunks");
      assertThat(relationshipIndex.edgeCount()).isZero();
    }
  }
}
