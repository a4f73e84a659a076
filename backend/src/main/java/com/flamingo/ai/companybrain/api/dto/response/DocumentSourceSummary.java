package com.flamingo.ai.companybrain.api.dto.response;

import com.flamingo.ai.companybrain.domain.enums.DocumentType;
import com.flamingo.ai.companybrain.domain.model.DocumentHit;
import com.flamingo.ai.companybrain.domain.model.DocumentMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A document cited by an answer. Position in the sources list is the citation number minus one. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentSourceSummary {

  private String id;
  private String title;
  private DocumentType type;
  private double relevanceScore;
  private String excerpt;
  private DocumentMetadata metadata;

  /** Creates a summary from a hit, cutting the excerpt to {@code excerptChars} plus "...". */
  public static DocumentSourceSummary fromHit(DocumentHit hit, int excerptChars) {
    String content = hit.getContent();
    String excerpt =
        content.length() > excerptChars ? content.substring(0, excerptChars) + "..." : content;
    return DocumentSourceSummary.builder()
        .id(hit.getId())
        .title(hit.getTitle())
        .type(hit.getType())
        .relevanceScore(hit.getScore() == null ? 0.0 : hit.getScore())
        .excerpt(excerpt)
        .metadata(hit.getMetadata())
        .build();
  }
}
