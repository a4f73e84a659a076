package com.flamingo.ai.companybrain.service.answer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.companybrain.config.RagConfig;
import com.flamingo.ai.companybrain.domain.model.ConversationTurn;
import com.flamingo.ai.companybrain.domain.model.DocumentHit;
import com.flamingo.ai.companybrain.domain.model.GroundingContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the grounding context and the prompt for answer generation.
 *
 * <p>The prompt is bounded whatever the input: at most {@code rag.context.max-hits} documents,
 * each with its content cut to {@code content-chars} and its title, category and department cut to
 * {@code label-chars}, and the last {@code history-turns} messages, each cut to {@code
 * history-chars}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContextAssembler {

  static final String INSTRUCTIONS =
      """
      Instructions:
      1. Base your answer ONLY on the provided company documents; do not fabricate.
      2. If documents contain relevant information, use it to answer concisely with brief \
      citations (e.g., Doc 1, Doc 2).
      3. If no relevant documents are found, say so briefly and suggest next steps.
      4. Do NOT use tools, calculators, or external resources.
      5. Perform any calculations mentally and show ONLY final results (no steps).
      6. Do NOT reveal chain-of-thought or reasoning; provide the answer and concise citations \
      only.
      7. Be helpful, professional, and conversational.
      8. Use conversation history only for context, not as a source of facts.

      Format your response as a short answer followed by optional citations like (Doc 1, Doc 3).""";

  private static final String ELLIPSIS = "...";

  private final RagConfig ragConfig;
  private final ObjectMapper objectMapper;

  public GroundingContext assemble(
      List<DocumentHit> hits, Map<String, Double> revenueByYear, List<ConversationTurn> history) {
    RagConfig.Context limits = ragConfig.getContext();
    List<DocumentHit> promptHits = hits.subList(0, Math.min(limits.getMaxHits(), hits.size()));

    int fromTurn = Math.max(0, history.size() - limits.getHistoryTurns());
    List<ConversationTurn> recent = new ArrayList<>();
    for (ConversationTurn turn : history.subList(fromTurn, history.size())) {
      recent.add(
          new ConversationTurn(turn.role(), truncate(turn.content(), limits.getHistoryChars())));
    }
    return new GroundingContext(promptHits, hits.size(), revenueByYear, recent);
  }

  public String renderPrompt(String question, GroundingContext context) {
    StringBuilder prompt = new StringBuilder();
    if (!context.revenueByYear().isEmpty()) {
      prompt
          .append("\nStructured Financial Data (from documents)\nRevenueByYear: ")
          .append(renderRevenue(context.revenueByYear()))
          .append("\n\n");
    }
    prompt
        .append("You are CompanyBrain AI, an intelligent assistant that helps users find ")
        .append("information from their company's knowledge base.\n\n");
    appendDocuments(prompt, context);
    prompt.append("\n\n");
    appendHistory(prompt, context.history());
    prompt.append("\n\nUser Question: ").append(question).append("\n\n").append(INSTRUCTIONS);

    log.debug(
        "Prompt assembled: {} chars, {} docs, {} history turns, financials={}",
        prompt.length(),
        context.hits().size(),
        context.history().size(),
        !context.revenueByYear().isEmpty());
    return prompt.toString();
  }

  private void appendDocuments(StringBuilder prompt, GroundingContext context) {
    if (context.hits().isEmpty()) {
      return;
    }
    int contentChars = ragConfig.getContext().getContentChars();
    int labelChars = ragConfig.getContext().getLabelChars();
    prompt
        .append("\nCompany Knowledge Base (")
        .append(context.retrievedCount())
        .append(" relevant documents found):\n");
    for (int i = 0; i < context.hits().size(); i++) {
      DocumentHit hit = context.hits().get(i);
      prompt
          .append('\n')
          .append(i + 1)
          .append(". **")
          .append(truncate(hit.getTitle(), labelChars))
          .append("** (")
          .append(hit.getType().getValue().toUpperCase(Locale.ROOT))
          .append(")\n   Category: ")
          .append(truncate(orNa(hit.getMetadata().getCategory()), labelChars))
          .append("\n   Department: ")
          .append(truncate(orNa(hit.getMetadata().getDepartment()), labelChars))
          .append("\n   Content: ")
          .append(truncate(hit.getContent(), contentChars))
          .append('\n');
    }
  }

  private static void appendHistory(StringBuilder prompt, List<ConversationTurn> history) {
    if (history.isEmpty()) {
      return;
    }
    prompt.append("\nRecent Conversation History:\n");
    for (ConversationTurn turn : history) {
      prompt.append(turn.role().getLabel()).append(": ").append(turn.content()).append('\n');
    }
  }

  /** Renders e.g. {@code {"2020":1200.5,"2021":3000}}; whole amounts print without a fraction. */
  String renderRevenue(Map<String, Double> revenueByYear) {
    Map<String, Number> ordered = new LinkedHashMap<>();
    for (Map.Entry<String, Double> entry : new TreeMap<>(revenueByYear).entrySet()) {
      double value = entry.getValue();
      boolean whole = value == Math.rint(value) && !Double.isInfinite(value);
      ordered.put(entry.getKey(), whole ? (Number) (long) value : (Number) value);
    }
    try {
      return objectMapper.writeValueAsString(ordered);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot render revenue table", e);
    }
  }

  static String truncate(String text, int maxChars) {
    if (text == null) {
      return "";
    }
    return text.length() > maxChars ? text.substring(0, maxChars) + ELLIPSIS : text;
  }

  private static String orNa(String value) {
    return value == null || value.isBlank() ? "N/A" : value;
  }
}
