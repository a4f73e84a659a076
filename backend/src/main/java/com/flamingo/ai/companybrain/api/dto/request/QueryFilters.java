package com.flamingo.ai.companybrain.api.dto.request;

import com.flamingo.ai.companybrain.domain.enums.DocumentType;
import com.flamingo.ai.companybrain.domain.model.SearchFilter;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Optional structured filters of a query request. Absent or empty lists do not filter. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryFilters {

  private List<DocumentType> documentTypes;
  private List<String> categories;
  private List<String> departments;
  private List<String> tags;
  private DateRangeFilter dateRange;

  /** Creation-date bounds, ISO-8601 date or date-time strings. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class DateRangeFilter {
    private String start;
    private String end;
  }

  /** Converts the request filters into the index-level filter. */
  public SearchFilter toSearchFilter() {
    List<String> types =
        documentTypes == null
            ? List.of()
            : documentTypes.stream().filter(t -> t != null).map(DocumentType::getValue).toList();
    SearchFilter.DateRange range =
        dateRange == null
            ? null
            : new SearchFilter.DateRange(dateRange.getStart(), dateRange.getEnd());
    return new SearchFilter(types, categories, departments, tags, range);
  }
}
