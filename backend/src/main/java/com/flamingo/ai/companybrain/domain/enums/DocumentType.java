package com.flamingo.ai.companybrain.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** File types accepted by the knowledge base, as stored in the index {@code type} field. */
public enum DocumentType {
  PDF("pdf", false),
  TXT("txt", false),
  CSV("csv", true),
  JSON("json", false),
  MD("md", false),
  DOCX("docx", false),
  XLSX("xlsx", true);

  private final String value;
  private final boolean tabular;

  DocumentType(String value, boolean tabular) {
    this.value = value;
    this.tabular = tabular;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Whether uploads of this type are stored as comma-separated rows. */
  public boolean isTabular() {
    return tabular;
  }

  public static Optional<DocumentType> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(t -> t.value.equals(normalized)).findFirst();
  }

  @JsonCreator
  public static DocumentType fromJson(String value) {
    return fromValue(value)
        .orElseThrow(() -> new IllegalArgumentException("Unsupported document type: " + value));
  }
}
