package com.healthbud.assessment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One prior exchange, oldest first when carried in a history list.
 */
public final class ConversationTurn {
    @JsonProperty("user_message") public final String userMessage;
    @JsonProperty("assistant_message") public final String assistantMessage;

    @JsonCreator
    public ConversationTurn(
            @JsonProperty("user_message") String userMessage,
            @JsonProperty("assistant_message") String assistantMessage) {
        this.userMessage = userMessage == null ? "" : userMessage;
        this.assistantMessage = assistantMessage == null ? "" : assistantMessage;
    }
}
