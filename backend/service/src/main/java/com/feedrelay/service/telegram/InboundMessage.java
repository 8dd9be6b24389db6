package com.feedrelay.service.telegram;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * The part of a Telegram update the relay acts on: a text message in a chat.
 */
public record InboundMessage(String chatId, String text) {

    public static Optional<InboundMessage> fromUpdate(JsonNode update) {
        JsonNode message = update.path("message");
        if (message.isMissingNode()) {
            message = update.path("edited_message");
        }
        JsonNode chatId = message.path("chat").path("id");
        JsonNode text = message.path("text");
        if (!(chatId.isIntegralNumber() || chatId.isTextual()) || !text.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(new InboundMessage(chatId.asText(), text.asText()));
    }
}
