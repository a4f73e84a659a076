package com.flamingo.ai.companybrain.service.facts;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parsing helpers shared by the fact extractors. */
final class NumericCells {

  private static final Pattern YEAR = Pattern.compile("(19|20)\\d{2}");
  private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.\\-]");

  private NumericCells() {}

  /**
   * Parses a cell such as {@code "$1,200.50"} by dropping everything except digits, dots and minus
   * signs. Empty or still-malformed cells yield empty.
   */
  static OptionalDouble parseNumber(String raw) {
    if (raw == null) {
      return OptionalDouble.empty();
    }
    String cleaned = NON_NUMERIC.matcher(raw).replaceAll("");
    if (cleaned.isEmpty()) {
      return OptionalDouble.empty();
    }
    try {
      return OptionalDouble.of(Double.parseDouble(cleaned));
    } catch (NumberFormatException e) {
      return OptionalDouble.empty();
    }
  }

  /** First 4-digit year between 1900 and 2099 inside the text. */
  static Optional<String> findYear(String text) {
    if (text == null) {
      return Optional.empty();
    }
    Matcher matcher = YEAR.matcher(text);
    return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
  }

  static String cell(String[] columns, int index) {
    return index >= 0 && index < columns.length ? columns[index].trim() : null;
  }
}
