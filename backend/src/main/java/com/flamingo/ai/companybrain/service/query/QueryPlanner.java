package com.flamingo.ai.companybrain.service.query;

import com.flamingo.ai.companybrain.config.RagConfig;
import com.flamingo.ai.companybrain.domain.enums.MetricKeyword;
import com.flamingo.ai.companybrain.domain.model.QueryPlan;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Derives the search intent of a question: which financial metrics and years it asks about, and
 * the search queries that cover them.
 *
 * <p>Planning is keyword based and cannot fail; the verbatim question is always the first query.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryPlanner {

  private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");

  private final RagConfig ragConfig;

  public QueryPlan plan(String question) {
    String base = question.trim();

    Set<String> metrics = new LinkedHashSet<>();
    for (MetricKeyword metric : MetricKeyword.values()) {
      if (metric.mentionedIn(base)) {
        metrics.add(metric.getCanonicalName());
      }
    }
    if (metrics.isEmpty()) {
      metrics.add(ragConfig.getPlanning().getDefaultMetric());
    }

    Set<String> years = new LinkedHashSet<>();
    Matcher matcher = YEAR.matcher(base);
    while (matcher.find()) {
      years.add(matcher.group());
    }

    List<String> searchQueries = new ArrayList<>();
    searchQueries.add(base);
    if (years.isEmpty()) {
      searchQueries.addAll(metrics);
    } else {
      String allYears = String.join(" ", years);
      for (String metric : metrics) {
        searchQueries.add(metric + " " + allYears);
        for (String year : years) {
          searchQueries.add(metric + " " + year);
        }
      }
    }

    QueryPlan plan = new QueryPlan(metrics, years, Set.of(), searchQueries);
    log.info(
        "Planned question: metrics={}, years={}, {} search queries",
        plan.metrics(),
        plan.years(),
        plan.searchQueries().size());
    return plan;
  }
}
