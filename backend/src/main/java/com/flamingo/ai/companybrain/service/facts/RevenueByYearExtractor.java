package com.flamingo.ai.companybrain.service.facts;

import com.flamingo.ai.companybrain.domain.model.DocumentHit;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the compact {@code year -> revenue} table fed to the answer prompt.
 *
 * <p>Only tabular documents (csv, xlsx) mentioning revenue are read. Within a document every row
 * with a month-column year adds to that year's total, and totals are summed across documents.
 * Documents reporting overlapping years (a forecast next to actuals, say) are therefore added
 * together.
 */
@Component
@Slf4j
public class RevenueByYearExtractor {

  private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
  private static final Pattern REVENUE = Pattern.compile("revenue", Pattern.CASE_INSENSITIVE);
  private static final Pattern MONTH = Pattern.compile("month", Pattern.CASE_INSENSITIVE);

  public Map<String, Double> extract(Iterable<DocumentHit> hits) {
    Map<String, Double> revenueByYear = new TreeMap<>();
    for (DocumentHit hit : hits) {
      if (!hit.getType().isTabular() || !REVENUE.matcher(hit.getContent()).find()) {
        continue;
      }
      try {
        extractFrom(hit.getContent(), revenueByYear);
      } catch (RuntimeException e) {
        log.warn("Skipping revenue extraction for '{}': {}", hit.getTitle(), e.getMessage());
      }
    }
    if (!revenueByYear.isEmpty()) {
      log.info("Revenue by year found for {} years", revenueByYear.size());
    }
    return revenueByYear;
  }

  private void extractFrom(String content, Map<String, Double> revenueByYear) {
    String[] lines = LINE_BREAK.split(content);
    int headerIndex = -1;
    for (int i = 0; i < lines.length; i++) {
      if (lines[i].contains(",") && REVENUE.matcher(lines[i]).find()) {
        headerIndex = i;
        break;
      }
    }
    if (headerIndex < 0) {
      return;
    }

    String[] headers = lines[headerIndex].split(",", -1);
    int monthColumn = firstMatching(headers, MONTH);
    int revenueColumn = firstMatching(headers, REVENUE);
    if (monthColumn < 0 || revenueColumn < 0) {
      return;
    }

    for (int i = headerIndex + 1; i < lines.length; i++) {
      String row = lines[i];
      if (row.isBlank() || !row.contains(",")) {
        continue;
      }
      String[] cells = row.split(",", -1);
      OptionalDouble revenue = NumericCells.parseNumber(NumericCells.cell(cells, revenueColumn));
      if (revenue.isEmpty()) {
        continue;
      }
      Optional<String> year = NumericCells.findYear(NumericCells.cell(cells, monthColumn));
      year.ifPresent(y -> revenueByYear.merge(y, revenue.getAsDouble(), Double::sum));
    }
  }

  private static int firstMatching(String[] headers, Pattern pattern) {
    for (int i = 0; i < headers.length; i++) {
      if (pattern.matcher(headers[i]).find()) {
        return i;
      }
    }
    return -1;
  }
}
