package com.flamingo.ai.companybrain.domain.model;

import java.util.List;

/**
 * Structured predicates passed through to the document index. Each clause is either absent (empty
 * list / null range) or a non-empty match set.
 */
public record SearchFilter(
    List<String> documentTypes,
    List<String> categories,
    List<String> departments,
    List<String> tags,
    DateRange dateRange) {

  public SearchFilter {
    documentTypes = clean(documentTypes);
    categories = clean(categories);
    departments = clean(departments);
    tags = clean(tags);
    if (dateRange != null && dateRange.isEmpty()) {
      dateRange = null;
    }
  }

  public static SearchFilter none() {
    return new SearchFilter(List.of(), List.of(), List.of(), List.of(), null);
  }

  public boolean isEmpty() {
    return documentTypes.isEmpty()
        && categories.isEmpty()
        && departments.isEmpty()
        && tags.isEmpty()
        && dateRange == null;
  }

  private static List<String> clean(List<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream().filter(v -> v != null && !v.isBlank()).map(String::trim).toList();
  }

  /** Inclusive creation-date range; either bound may be open. */
  public record DateRange(String start, String end) {

    boolean isEmpty() {
      return (start == null || start.isBlank()) && (end == null || end.isBlank());
    }
  }
}
