package com.flamingo.ai.companybrain.domain.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Financial metrics recognised in questions and in document content.
 *
 * <p>The question pattern also accepts common synonyms ("sales", "profit"); the content pattern
 * only accepts the metric's own name so that a table with both a Revenue and a Sales column is
 * not folded into one figure.
 */
public enum MetricKeyword {
  REVENUE("revenue", "revenue|sales", "revenue"),
  NET_INCOME("net income", "net\\s*income|profit", "net\\s*income"),
  EBITDA("ebitda", "ebitda", "ebitda"),
  ASSETS("assets", "assets", "assets"),
  LIABILITIES("liabilities", "liabilities", "liabilities"),
  EQUITY("equity", "equity", "equity");

  /** Alternation of every content pattern, case-insensitive. */
  public static final String CONTENT_ALTERNATION =
      Arrays.stream(values())
          .map(MetricKeyword::getContentPattern)
          .collect(Collectors.joining("|"));

  private final String canonicalName;
  private final String questionPattern;
  private final String contentPattern;
  private final Pattern questionRegex;
  private final Pattern contentRegex;

  MetricKeyword(String canonicalName, String questionPattern, String contentPattern) {
    this.canonicalName = canonicalName;
    this.questionPattern = questionPattern;
    this.contentPattern = contentPattern;
    this.questionRegex = Pattern.compile(questionPattern, Pattern.CASE_INSENSITIVE);
    this.contentRegex = Pattern.compile(contentPattern, Pattern.CASE_INSENSITIVE);
  }

  public String getCanonicalName() {
    return canonicalName;
  }

  public String getQuestionPattern() {
    return questionPattern;
  }

  public String getContentPattern() {
    return contentPattern;
  }

  public boolean mentionedIn(String question) {
    return question != null && questionRegex.matcher(question).find();
  }

  public boolean appearsInContent(String text) {
    return text != null && contentRegex.matcher(text).find();
  }

  /** Returns the first metric (in declaration order) whose name appears in the given content. */
  public static Optional<MetricKeyword> firstInContent(String text) {
    return Arrays.stream(values()).filter(m -> m.appearsInContent(text)).findFirst();
  }

  /** Maps a matched metric phrase such as "Net  Income" back to its metric. */
  public static Optional<MetricKeyword> fromPhrase(String phrase) {
    if (phrase == null) {
      return Optional.empty();
    }
    String normalized = phrase.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    return firstInContent(normalized);
  }
}
