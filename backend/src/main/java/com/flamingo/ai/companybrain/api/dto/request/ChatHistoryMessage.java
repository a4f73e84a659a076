package com.flamingo.ai.companybrain.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.companybrain.domain.enums.MessageRole;
import com.flamingo.ai.companybrain.domain.model.ConversationTurn;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A previous chat message sent along with a question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatHistoryMessage {

  private String id;
  private String content;

  @JsonProperty("isUser")
  private Boolean isUser;

  private String timestamp;

  public ConversationTurn toTurn() {
    MessageRole role = Boolean.TRUE.equals(isUser) ? MessageRole.USER : MessageRole.ASSISTANT;
    return new ConversationTurn(role, content == null ? "" : content);
  }
}
