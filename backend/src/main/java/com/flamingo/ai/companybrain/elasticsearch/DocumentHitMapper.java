package com.flamingo.ai.companybrain.elasticsearch;

import com.flamingo.ai.companybrain.domain.enums.DocumentType;
import com.flamingo.ai.companybrain.domain.model.DocumentHit;
import com.flamingo.ai.companybrain.domain.model.DocumentMetadata;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts raw {@code _source} maps from the index into {@link DocumentHit}s.
 *
 * <p>Documents are written by the upload pipeline with a loose shape. A hit without a title,
 * without content or with an unknown type is rejected here so nothing downstream has to check
 * optional fields.
 */
@Component
@Slf4j
public class DocumentHitMapper {

  /**
   * Maps one search hit.
   *
   * @param hitId the Elasticsearch {@code _id}
   * @param score the hit score, may be null
   * @param source the {@code _source} document
   * @return the hit, or empty when the source does not satisfy the document schema
   */
  public Optional<DocumentHit> map(String hitId, Double score, Map<String, Object> source) {
    if (source == null) {
      log.warn("Dropping hit {} without _source", hitId);
      return Optional.empty();
    }
    String title = asString(source.get("title"));
    String content = asString(source.get("content"));
    Optional<DocumentType> type = DocumentType.fromValue(asString(source.get("type")));
    if (title == null || content == null || type.isEmpty()) {
      log.warn(
          "Dropping hit {} failing document schema: title={}, content={}, type={}",
          hitId,
          title != null,
          content != null,
          source.get("type"));
      return Optional.empty();
    }

    String id = asString(source.get("id"));
    return Optional.of(
        DocumentHit.builder()
            .id(id != null && !id.isBlank() ? id : hitId)
            .title(title)
            .type(type.get())
            .content(content)
            .metadata(mapMetadata(source.get("metadata")))
            .score(score)
            .createdAt(asString(source.get("createdAt")))
            .build());
  }

  private DocumentMetadata mapMetadata(Object raw) {
    if (!(raw instanceof Map<?, ?> metadata)) {
      return DocumentMetadata.empty();
    }
    return DocumentMetadata.builder()
        .fileName(asString(metadata.get("fileName")))
        .fileSize(asLong(metadata.get("fileSize")))
        .mimeType(asString(metadata.get("mimeType")))
        .uploadDate(asString(metadata.get("uploadDate")))
        .tags(asStringList(metadata.get("tags")))
        .category(asString(metadata.get("category")))
        .author(asString(metadata.get("author")))
        .department(asString(metadata.get("department")))
        .project(asString(metadata.get("project")))
        .version(asString(metadata.get("version")))
        .language(asString(metadata.get("language")))
        .summary(asString(metadata.get("summary")))
        .build();
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  private static Long asLong(Object value) {
    if (value instanceof Number n) {
      return n.longValue();
    }
    if (value instanceof String s) {
      try {
        return Long.parseLong(s.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static List<String> asStringList(Object value) {
    if (value instanceof List<?> list) {
      return list.stream().filter(v -> v != null).map(Object::toString).toList();
    }
    if (value instanceof String s && !s.isBlank()) {
      return List.of(s);
    }
    return List.of();
  }
}
