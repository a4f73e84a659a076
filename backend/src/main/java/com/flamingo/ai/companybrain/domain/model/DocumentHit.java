package com.flamingo.ai.companybrain.domain.model;

import com.flamingo.ai.companybrain.domain.enums.DocumentType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A document returned by the index for one search request. Immutable once retrieved.
 *
 * <p>{@link #identityKey()} is what collapses the same document found by several sub-queries: the
 * index id, or {@code title:createdAt} for documents stored without one.
 */
@Value
@Builder(toBuilder = true)
public class DocumentHit {

  String id;
  @NonNull String title;
  @NonNull DocumentType type;
  @NonNull String content;
  @NonNull @Builder.Default DocumentMetadata metadata = DocumentMetadata.empty();

  /** Relevance score from the index, null when the request was not scored. */
  Double score;

  String createdAt;

  public String identityKey() {
    if (id != null && !id.isBlank()) {
      return id;
    }
    return title + ":" + createdAt;
  }
}
