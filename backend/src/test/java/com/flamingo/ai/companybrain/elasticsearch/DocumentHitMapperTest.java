package com.flamingo.ai.companybrain.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.companybrain.domain.enums.DocumentType;
import com.flamingo.ai.companybrain.domain.model.DocumentHit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DocumentHitMapper Tests")
class DocumentHitMapperTest {

  private final DocumentHitMapper mapper = new DocumentHitMapper();

  @Test
  @DisplayName("Should map a complete source document")
  void shouldMapCompleteSource() {
    Map<String, Object> metadata = new HashMap<>();
    metadata.put("fileName", "revenue.csv");
    metadata.put("fileSize", 2048);
    metadata.put("category", "finance");
    metadata.put("department", "Accounting");
    metadata.put("tags", List.of("revenue", "monthly"));
    Map<String, Object> source = source("doc-1", "Revenue 2021", "csv", "Month,Revenue");
    source.put("metadata", metadata);
    source.put("createdAt", "2024-03-01T10:00:00Z");

    Optional<DocumentHit> hit = mapper.map("es-id", 2.5, source);

    assertThat(hit).isPresent();
    assertThat(hit.get().getId()).isEqualTo("doc-1");
    assertThat(hit.get().getType()).isEqualTo(DocumentType.CSV);
    assertThat(hit.get().getScore()).isEqualTo(2.5);
    assertThat(hit.get().getCreatedAt()).isEqualTo("2024-03-01T10:00:00Z");
    assertThat(hit.get().getMetadata().getFileSize()).isEqualTo(2048L);
    assertThat(hit.get().getMetadata().getCategory()).isEqualTo("finance");
    assertThat(hit.get().getMetadata().getTags()).containsExactly("revenue", "monthly");
  }

  @Test
  @DisplayName("Should fall back to the index id when the source has none")
  void shouldFallBackToHitId() {
    Optional<DocumentHit> hit = mapper.map("es-id", null, source(null, "Notes", "txt", "text"));

    assertThat(hit).map(DocumentHit::getId).contains("es-id");
    assertThat(hit).map(DocumentHit::getScore).isEmpty();
  }

  @Test
  @DisplayName("Should use empty metadata when the source has none")
  void shouldDefaultMetadata() {
    Optional<DocumentHit> hit = mapper.map("x", 1.0, source("x", "Notes", "md", "text"));

    assertThat(hit).isPresent();
    assertThat(hit.get().getMetadata().getTags()).isEmpty();
    assertThat(hit.get().getMetadata().getCategory()).isNull();
  }

  @Test
  @DisplayName("Should drop documents missing title or content")
  void shouldDropIncompleteDocuments() {
    assertThat(mapper.map("a", 1.0, source("a", null, "pdf", "text"))).isEmpty();
    assertThat(mapper.map("b", 1.0, source("b", "Title", "pdf", null))).isEmpty();
    assertThat(mapper.map("c", 1.0, null)).isEmpty();
  }

  @Test
  @DisplayName("Should drop documents with an unknown type")
  void shouldDropUnknownType() {
    assertThat(mapper.map("a", 1.0, source("a", "Slides", "pptx", "text"))).isEmpty();
    assertThat(mapper.map("b", 1.0, source("b", "Slides", null, "text"))).isEmpty();
  }

  private static Map<String, Object> source(String id, String title, String type, String content) {
    Map<String, Object> source = new HashMap<>();
    source.put("id", id);
    source.put("title", title);
    source.put("type", type);
    source.put("content", content);
    return source;
  }
}
