package com.flamingo.ai.companybrain.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.companybrain.api.rest.HealthController;
import com.flamingo.ai.companybrain.api.rest.QueryController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify the public endpoints keep their paths:
 *
 * <ul>
 *   <li>POST /api/query - Answer a question
 *   <li>GET /api/health - Index reachability
 * </ul>
 *
 * <p>Clients depend on these paths; a failure here means a mapping has drifted.
 */
class ApiContractTest {

  @Nested
  @DisplayName("QueryController API contract")
  class QueryControllerContract {

    @Test
    @DisplayName("should be mapped to /api/query")
    void shouldBeMappedToApiQuery() {
      RequestMapping mapping = QueryController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/query");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /api/health")
    void shouldBeMappedToApiHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/health");
    }
  }
}
