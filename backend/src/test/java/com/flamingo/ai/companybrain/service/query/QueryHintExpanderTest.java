package com.flamingo.ai.companybrain.service.query;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("QueryHintExpander Tests")
class QueryHintExpanderTest {

  private final QueryHintExpander expander = new QueryHintExpander();

  @Test
  @DisplayName("Should list every document type when no keyword matches")
  void shouldDefaultToAllTypes() {
    assertThat(expander.expand("What was our revenue in 2021?"))
        .isEqualTo(
            "Focus on document types: pdf, docx, md, xlsx, csv, json, txt. "
                + "Search fields: title, content, metadata.summary.");
  }

  @Test
  @DisplayName("Should merge types from several rules without duplicates")
  void shouldMergeTypeRules() {
    assertThat(expander.expand("Policy report from the last meeting"))
        .startsWith("Focus on document types: pdf, docx, md, xlsx, csv, txt.");
  }

  @Test
  @DisplayName("Should add metadata fields for department, owner, topic and category")
  void shouldAddMetadataFields() {
    assertThat(expander.expand("Which department owner covers this topic category?"))
        .endsWith(
            "Search fields: title, content, metadata.summary, metadata.department, "
                + "metadata.author, metadata.tags, metadata.category.");
  }

  @Test
  @DisplayName("Should match keywords case-insensitively")
  void shouldIgnoreCase() {
    assertThat(expander.expand("API SCHEMA")).startsWith("Focus on document types: json, md.");
  }
}
