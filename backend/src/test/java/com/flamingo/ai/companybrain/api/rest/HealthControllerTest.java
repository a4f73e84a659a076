package com.flamingo.ai.companybrain.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.companybrain.elasticsearch.DocumentIndexOperations;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthController Tests")
class HealthControllerTest {

  @Mock private DocumentIndexOperations documentIndex;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    when(documentIndex.getIndexName()).thenReturn("company-memory");
    mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(documentIndex)).build();
  }

  @Test
  @DisplayName("Should report UP when the index answers")
  void shouldReportUp() throws Exception {
    when(documentIndex.healthCheck()).thenReturn(true);

    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.elasticsearch").value("UP"))
        .andExpect(jsonPath("$.index").value("company-memory"))
        .andExpect(jsonPath("$.timestamp").exists());
  }

  @Test
  @DisplayName("Should report DEGRADED with 200 when the index is down")
  void shouldReportDegraded() throws Exception {
    when(documentIndex.healthCheck()).thenReturn(false);

    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DEGRADED"))
        .andExpect(jsonPath("$.elasticsearch").value("DOWN"));
  }
}
