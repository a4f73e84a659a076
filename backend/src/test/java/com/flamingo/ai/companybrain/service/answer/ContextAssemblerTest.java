package com.flamingo.ai.companybrain.service.answer;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.companybrain.config.RagConfig;
import com.flamingo.ai.companybrain.domain.enums.DocumentType;
import com.flamingo.ai.companybrain.domain.enums.MessageRole;
import com.flamingo.ai.companybrain.domain.model.ConversationTurn;
import com.flamingo.ai.companybrain.domain.model.DocumentHit;
import com.flamingo.ai.companybrain.domain.model.DocumentMetadata;
import com.flamingo.ai.companybrain.domain.model.GroundingContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ContextAssembler Tests")
class ContextAssemblerTest {

  private ContextAssembler contextAssembler;

  @BeforeEach
  void setUp() {
    contextAssembler = new ContextAssembler(new RagConfig(), new ObjectMapper());
  }

  @Nested
  @DisplayName("Grounding context")
  class Assemble {

    @Test
    @DisplayName("Should keep only the first five hits but remember how many were found")
    void shouldLimitHits() {
      List<DocumentHit> hits = new ArrayList<>();
      for (int i = 1; i <= 8; i++) {
        hits.add(hit("doc" + i, "body"));
      }

      GroundingContext context = contextAssembler.assemble(hits, Map.of(), List.of());

      assertThat(context.hits())
          .extracting(DocumentHit::getId)
          .containsExactly("doc1", "doc2", "doc3", "doc4", "doc5");
      assertThat(context.retrievedCount()).isEqualTo(8);
    }

    @Test
    @DisplayName("Should keep the last six turns, each cut to 200 characters")
    void shouldTrimHistory() {
      List<ConversationTurn> history = new ArrayList<>();
      for (int i = 1; i <= 8; i++) {
        MessageRole role = i % 2 == 1 ? MessageRole.USER : MessageRole.ASSISTANT;
        history.add(new ConversationTurn(role, i + ":" + "x".repeat(250)));
      }

      GroundingContext context = contextAssembler.assemble(List.of(), Map.of(), history);

      assertThat(context.history()).hasSize(6);
      assertThat(context.history().get(0).content()).startsWith("3:");
      assertThat(context.history())
          .allSatisfy(turn -> assertThat(turn.content()).hasSize(203).endsWith("..."));
    }
  }

  @Nested
  @DisplayName("Prompt rendering")
  class RenderPrompt {

    @Test
    @DisplayName("Should render numbered documents with type, category, department and content")
    void shouldRenderDocuments() {
      DocumentHit hit =
          DocumentHit.builder()
              .id("d1")
              .title("Q3 Report")
              .type(DocumentType.PDF)
              .content("y".repeat(400))
              .metadata(DocumentMetadata.builder().category("finance").build())
              .build();
      GroundingContext context = contextAssembler.assemble(List.of(hit), Map.of(), List.of());

      String prompt = contextAssembler.renderPrompt("How did Q3 go?", context);

      assertThat(prompt)
          .contains("Company Knowledge Base (1 relevant documents found):")
          .contains("1. **Q3 Report** (PDF)")
          .contains("Category: finance")
          .contains("Department: N/A")
          .contains("Content: " + "y".repeat(300) + "...\n")
          .doesNotContain("y".repeat(301))
          .contains("User Question: How did Q3 go?")
          .contains("do not fabricate");
    }

    @Test
    @DisplayName("Should put the revenue block first when revenue was found")
    void shouldPrependRevenueBlock() {
      Map<String, Double> revenue = new LinkedHashMap<>();
      revenue.put("2021", 3000.0);
      revenue.put("2020", 1250.5);
      GroundingContext context = contextAssembler.assemble(List.of(), revenue, List.of());

      String prompt = contextAssembler.renderPrompt("revenue?", context);

      assertThat(prompt)
          .startsWith(
              "\nStructured Financial Data (from documents)\n"
                  + "RevenueByYear: {\"2020\":1250.5,\"2021\":3000}\n\n");
    }

    @Test
    @DisplayName("Should omit empty sections")
    void shouldOmitEmptySections() {
      GroundingContext context = contextAssembler.assemble(List.of(), Map.of(), List.of());

      String prompt = contextAssembler.renderPrompt("anything?", context);

      assertThat(prompt)
          .startsWith("You are CompanyBrain AI")
          .doesNotContain("RevenueByYear")
          .doesNotContain("Company Knowledge Base")
          .doesNotContain("Recent Conversation History")
          .endsWith("(Doc 1, Doc 3).");
    }

    @Test
    @DisplayName("Should label conversation turns by role")
    void shouldRenderHistory() {
      List<ConversationTurn> history =
          List.of(
              new ConversationTurn(MessageRole.USER, "What about 2020?"),
              new ConversationTurn(MessageRole.ASSISTANT, "Revenue was 1000."));
      GroundingContext context = contextAssembler.assemble(List.of(), Map.of(), history);

      String prompt = contextAssembler.renderPrompt("And 2021?", context);

      assertThat(prompt)
          .contains(
              "Recent Conversation History:\n"
                  + "User: What about 2020?\nAssistant: Revenue was 1000.\n");
    }

    @Test
    @DisplayName("Should stay bounded whatever the size of the input")
    void shouldBeBounded() {
      List<DocumentHit> hits = new ArrayList<>();
      for (int i = 0; i < 50; i++) {
        hits.add(hit("doc" + i, "z".repeat(100_000)));
      }
      List<ConversationTurn> history = new ArrayList<>();
      for (int i = 0; i < 100; i++) {
        history.add(new ConversationTurn(MessageRole.USER, "h".repeat(10_000)));
      }
      GroundingContext context = contextAssembler.assemble(hits, Map.of(), history);

      String prompt = contextAssembler.renderPrompt("q", context);

      assertThat(prompt.length()).isLessThan(6_000);
    }

    @Test
    @DisplayName("Should cut oversized titles and metadata labels")
    void shouldCutLabels() {
      DocumentHit hit =
          DocumentHit.builder()
              .id("doc")
              .title("T".repeat(50_000))
              .type(DocumentType.PDF)
              .content("body")
              .metadata(
                  DocumentMetadata.builder()
                      .category("C".repeat(50_000))
                      .department("D".repeat(50_000))
                      .build())
              .build();
      GroundingContext context = contextAssembler.assemble(List.of(hit), Map.of(), List.of());

      String prompt = contextAssembler.renderPrompt("q", context);

      assertThat(prompt)
          .contains("1. **" + "T".repeat(100) + "...** (PDF)")
          .contains("Category: " + "C".repeat(100) + "...\n")
          .contains("Department: " + "D".repeat(100) + "...\n")
          .doesNotContain("T".repeat(101));
      assertThat(prompt.length()).isLessThan(3_000);
    }
  }

  private static DocumentHit hit(String id, String content) {
    return DocumentHit.builder()
        .id(id)
        .title("Title " + id)
        .type(DocumentType.TXT)
        .content(content)
        .build();
  }
}
