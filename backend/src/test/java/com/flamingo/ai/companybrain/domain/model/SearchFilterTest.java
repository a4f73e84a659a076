package com.flamingo.ai.companybrain.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.companybrain.api.dto.request.QueryFilters;
import com.flamingo.ai.companybrain.domain.enums.DocumentType;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SearchFilter Tests")
class SearchFilterTest {

  @Test
  @DisplayName("Should treat absent clauses as no filter")
  void shouldBeEmptyWithoutClauses() {
    SearchFilter filter = new SearchFilter(null, List.of(), null, List.of(" "), null);

    assertThat(filter.isEmpty()).isTrue();
    assertThat(SearchFilter.none().isEmpty()).isTrue();
  }

  @Test
  @DisplayName("Should drop blank values and an open-ended empty date range")
  void shouldCleanValues() {
    SearchFilter filter =
        new SearchFilter(
            List.of("csv"),
            Arrays.asList(" Finance ", null, ""),
            null,
            null,
            new SearchFilter.DateRange(" ", null));

    assertThat(filter.categories()).containsExactly("Finance");
    assertThat(filter.dateRange()).isNull();
    assertThat(filter.isEmpty()).isFalse();
  }

  @Test
  @DisplayName("Should convert request filters to index filters")
  void shouldConvertRequestFilters() {
    QueryFilters filters =
        QueryFilters.builder()
            .documentTypes(List.of(DocumentType.XLSX, DocumentType.CSV))
            .tags(List.of("q4"))
            .dateRange(new QueryFilters.DateRangeFilter("2021-01-01", null))
            .build();

    SearchFilter filter = filters.toSearchFilter();

    assertThat(filter.documentTypes()).containsExactly("xlsx", "csv");
    assertThat(filter.tags()).containsExactly("q4");
    assertThat(filter.dateRange()).isEqualTo(new SearchFilter.DateRange("2021-01-01", null));
  }
}
