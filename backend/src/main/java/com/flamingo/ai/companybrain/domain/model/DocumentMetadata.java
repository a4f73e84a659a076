package com.flamingo.ai.companybrain.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Descriptive metadata stored alongside an indexed company document. */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentMetadata {

  String fileName;
  Long fileSize;
  String mimeType;
  String uploadDate;
  @Builder.Default List<String> tags = List.of();
  String category;
  String author;
  String department;
  String project;
  String version;
  String language;
  String summary;

  public static DocumentMetadata empty() {
    return DocumentMetadata.builder().build();
  }
}
