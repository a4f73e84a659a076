package com.flamingo.ai.companybrain.service.query;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Strips markup and script fragments from user-supplied text before it is searched or echoed. */
@Component
public class QueryInputSanitizer {

  private static final Pattern ANGLE_BRACKETS = Pattern.compile("[<>]");
  private static final Pattern JAVASCRIPT_SCHEME =
      Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE);
  private static final Pattern INLINE_HANDLER =
      Pattern.compile("on\\w+=", Pattern.CASE_INSENSITIVE);

  /** Returns the cleaned, trimmed text; null input yields an empty string. */
  public String sanitize(String input) {
    if (input == null) {
      return "";
    }
    String cleaned = ANGLE_BRACKETS.matcher(input).replaceAll("");
    cleaned = JAVASCRIPT_SCHEME.matcher(cleaned).replaceAll("");
    cleaned = INLINE_HANDLER.matcher(cleaned).replaceAll("");
    return cleaned.trim();
  }
}
