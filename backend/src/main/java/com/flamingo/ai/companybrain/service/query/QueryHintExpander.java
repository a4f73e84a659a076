package com.flamingo.ai.companybrain.service.query;

import com.flamingo.ai.companybrain.domain.enums.DocumentType;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Produces the human-readable search hint returned as {@code expandedQuery}: which document types
 * and fields a question most likely targets, inferred from keywords.
 */
@Component
public class QueryHintExpander {

  private static final List<String> BASE_FIELDS = List.of("title", "content", "metadata.summary");

  private static final List<DocumentType> ALL_TYPES =
      List.of(
          DocumentType.PDF,
          DocumentType.DOCX,
          DocumentType.MD,
          DocumentType.XLSX,
          DocumentType.CSV,
          DocumentType.JSON,
          DocumentType.TXT);

  private record Rule(List<String> keywords, List<DocumentType> types) {}

  private record FieldRule(List<String> keywords, String field) {}

  private static final List<Rule> TYPE_RULES =
      List.of(
          new Rule(
              List.of("policy", "guideline", "procedure"),
              List.of(DocumentType.PDF, DocumentType.DOCX, DocumentType.MD)),
          new Rule(
              List.of("report", "metrics", "trend"),
              List.of(DocumentType.XLSX, DocumentType.CSV, DocumentType.PDF)),
          new Rule(List.of("api", "schema", "json"), List.of(DocumentType.JSON, DocumentType.MD)),
          new Rule(
              List.of("meeting", "notes"),
              List.of(DocumentType.TXT, DocumentType.MD, DocumentType.DOCX)));

  private static final List<FieldRule> FIELD_RULES =
      List.of(
          new FieldRule(List.of("department"), "metadata.department"),
          new FieldRule(List.of("author", "owner"), "metadata.author"),
          new FieldRule(List.of("tag", "topic"), "metadata.tags"),
          new FieldRule(List.of("category"), "metadata.category"));

  public String expand(String query) {
    String lower = query.toLowerCase(Locale.ROOT);

    Set<DocumentType> types = new LinkedHashSet<>();
    for (Rule rule : TYPE_RULES) {
      if (containsAny(lower, rule.keywords())) {
        types.addAll(rule.types());
      }
    }
    Set<String> fields = new LinkedHashSet<>(BASE_FIELDS);
    for (FieldRule rule : FIELD_RULES) {
      if (containsAny(lower, rule.keywords())) {
        fields.add(rule.field());
      }
    }

    String typeList = join(types.isEmpty() ? ALL_TYPES : types);
    return "Focus on document types: "
        + typeList
        + ". Search fields: "
        + String.join(", ", fields)
        + ".";
  }

  private static boolean containsAny(String text, List<String> keywords) {
    return keywords.stream().anyMatch(text::contains);
  }

  private static String join(Collection<DocumentType> types) {
    return types.stream().map(DocumentType::getValue).collect(Collectors.joining(", "));
  }
}
