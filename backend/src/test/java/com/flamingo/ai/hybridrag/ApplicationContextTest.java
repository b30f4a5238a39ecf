package com.flamingo.ai.hybridrag;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.hybridrag.service.HybridRagService;
import com.flamingo.ai.hybridrag.service.llm.TextGenerator;
import com.flamingo.ai.hybridrag.store.RelationshipIndex;
import com.flamingo.ai.hybridrag.store.SemanticIndex;
import com.flamingo.ai.hybridrag.store.memory.InMemoryRelationshipIndex;
import com.flamingo.ai.hybridrag.store.memory.InMemorySemanticIndex;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the application context loads with the default in-memory stores and no chat model.
 * The embedding model is mocked so the test does not load the ONNX model.
 */
@SpringBootTest(properties = "langchain4j.openai.api-key=")
class ApplicationContextTest {

  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
    assertThat(applicationContext.getBean(HybridRagService.class)).isNotNull();
  }

  @Test
  @DisplayName("Default stores should be in-memory")
  void defaultStoresShouldBeInMemory() {
    assertThat(applicationContext.getBean(SemanticIndex.class))
        .isInstanceOf(InMemorySemanticIndex.class);
    assertThat(applicationContext.getBean(RelationshipIndex.class))
        .isInstanceOf(InMemoryRelationshipIndex.class);
  }

  @Test
  @DisplayName("Text generator should be unavailable without an API key")
  void textGeneratorShouldBeUnavailableWithoutApiKey() {
    assertThat(applicationContext.getBeanNamesForType(ChatModel.class)).isEmpty();
    assertThat(applicationContext.getBean(TextGenerator.class).isAvailable()).isFalse();
  }
}
