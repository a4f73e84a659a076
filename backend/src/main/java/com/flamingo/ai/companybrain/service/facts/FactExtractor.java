package com.flamingo.ai.companybrain.service.facts;

import com.flamingo.ai.companybrain.domain.enums.MetricKeyword;
import com.flamingo.ai.companybrain.domain.model.DocumentHit;
import com.flamingo.ai.companybrain.domain.model.MetricFact;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Best-effort extraction of {@code (metric, year, value)} facts from document text.
 *
 * <p>Two rules, applied per document:
 *
 * <ol>
 *   <li>Tabular: the first comma-separated line with a month/date/period column and a metric
 *       column is the header. Rows take their year from the period column and one value per
 *       metric column.
 *   <li>Free text: when no such header exists, phrases like "revenue in 2021 was $1,200" are
 *       matched anywhere in the content.
 * </ol>
 *
 * <p>Cells are split on plain commas, so quoted values containing commas are not supported. Rows
 * and matches that do not parse are skipped; extraction never throws.
 */
@Component
@Slf4j
public class FactExtractor {

  private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
  private static final Pattern METRIC_HEADER =
      Pattern.compile(MetricKeyword.CONTENT_ALTERNATION, Pattern.CASE_INSENSITIVE);
  private static final Pattern PERIOD_COLUMN =
      Pattern.compile("month|date|period", Pattern.CASE_INSENSITIVE);
  private static final Pattern FREE_TEXT_FACT =
      Pattern.compile(
          "("
              + MetricKeyword.CONTENT_ALTERNATION
              + ")[^\\d]*((?:19|20)\\d{2})[^\\d]*([$€£]?\\s*[\\d,.]+)",
          Pattern.CASE_INSENSITIVE);

  public List<MetricFact> extract(List<DocumentHit> hits) {
    List<MetricFact> facts = new ArrayList<>();
    for (DocumentHit hit : hits) {
      try {
        if (!extractTabular(hit, facts)) {
          extractFreeText(hit, facts);
        }
      } catch (RuntimeException e) {
        log.warn("Skipping fact extraction for '{}': {}", hit.getTitle(), e.getMessage());
      }
    }
    log.debug("Extracted {} metric facts from {} hits", facts.size(), hits.size());
    return facts;
  }

  /**
   * Sums facts sharing a metric and a year, across rows and across documents.
   *
   * @return metric to (year to total), years in ascending order
   */
  public Map<String, Map<String, Double>> sumByMetricAndYear(List<MetricFact> facts) {
    Map<String, Map<String, Double>> totals = new LinkedHashMap<>();
    for (MetricFact fact : facts) {
      totals
          .computeIfAbsent(fact.metric(), m -> new TreeMap<>())
          .merge(fact.year(), fact.value(), Double::sum);
    }
    return totals;
  }

  /** Returns true when a table header was found, whether or not any row produced a fact. */
  private boolean extractTabular(DocumentHit hit, List<MetricFact> facts) {
    String[] lines = LINE_BREAK.split(hit.getContent());
    Optional<TableHeader> found = findHeader(lines);
    if (found.isEmpty()) {
      return false;
    }
    TableHeader header = found.get();
    int headerIndex = header.line();
    int periodColumn = header.periodColumn();
    Map<MetricKeyword, Integer> metricColumns = header.metricColumns();

    for (int i = headerIndex + 1; i < lines.length; i++) {
      String row = lines[i];
      if (!row.contains(",")) {
        continue;
      }
      try {
        String[] cells = row.split(",", -1);
        Optional<String> year = NumericCells.findYear(NumericCells.cell(cells, periodColumn));
        if (year.isEmpty()) {
          continue;
        }
        for (Map.Entry<MetricKeyword, Integer> column : metricColumns.entrySet()) {
          OptionalDouble value =
              NumericCells.parseNumber(NumericCells.cell(cells, column.getValue()));
          if (value.isPresent()) {
            facts.add(
                new MetricFact(
                    column.getKey().getCanonicalName(),
                    year.get(),
                    value.getAsDouble(),
                    hit.getTitle()));
          }
        }
      } catch (RuntimeException e) {
        log.debug("Skipping row {} of '{}': {}", i, hit.getTitle(), e.getMessage());
      }
    }
    return true;
  }

  /**
   * The first comma-separated line with a month/date/period column and a separate metric column.
   * Prose sentences with thousands separators contain commas but rarely split into such columns.
   */
  private static Optional<TableHeader> findHeader(String[] lines) {
    for (int i = 0; i < lines.length; i++) {
      if (!lines[i].contains(",") || !METRIC_HEADER.matcher(lines[i]).find()) {
        continue;
      }
      String[] headers = lines[i].split(",", -1);
      int periodColumn = -1;
      Map<MetricKeyword, Integer> metricColumns = new LinkedHashMap<>();
      for (int col = 0; col < headers.length; col++) {
        String header = headers[col].trim();
        if (periodColumn < 0 && PERIOD_COLUMN.matcher(header).find()) {
          periodColumn = col;
          continue;
        }
        int column = col;
        MetricKeyword.firstInContent(header).ifPresent(m -> metricColumns.putIfAbsent(m, column));
      }
      if (periodColumn >= 0 && !metricColumns.isEmpty()) {
        return Optional.of(new TableHeader(i, periodColumn, metricColumns));
      }
    }
    return Optional.empty();
  }

  private void extractFreeText(DocumentHit hit, List<MetricFact> facts) {
    Matcher matcher = FREE_TEXT_FACT.matcher(hit.getContent());
    while (matcher.find()) {
      Optional<MetricKeyword> metric = MetricKeyword.fromPhrase(matcher.group(1));
      OptionalDouble value = NumericCells.parseNumber(matcher.group(3));
      if (metric.isPresent() && value.isPresent()) {
        facts.add(
            new MetricFact(
                metric.get().getCanonicalName(),
                matcher.group(2),
                value.getAsDouble(),
                hit.getTitle()));
      }
    }
  }

  private record TableHeader(
      int line, int periodColumn, Map<MetricKeyword, Integer> metricColumns) {}
}
