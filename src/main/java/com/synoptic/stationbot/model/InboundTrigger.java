package com.synoptic.stationbot.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.core.annotation.Introspected;
import io.micronaut.core.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * A command or menu selection delivered by the chat transport.
 *
 * <p>Commands carry the command text (e.g. {@code /start}) as payload and no
 * message id; menu selections carry the encoded navigation token and the id of the
 * message holding the menu.
 */
@Introspected
public record InboundTrigger(

        /**
         * Conversation (chat) the trigger came from; replies go back here.
         */
        @NotNull(message = "conversationId must not be null")
        @JsonProperty("conversationId")
        Long conversationId,

        /**
         * Message holding the menu that was clicked. Null for typed commands.
         */
        @Nullable
        @JsonProperty("messageId")
        Integer messageId,

        /**
         * Stable identifier of the user; quota is accounted per user.
         */
        @NotNull(message = "userId must not be null")
        @JsonProperty("userId")
        Long userId,

        /**
         * Name of the user at the time of the trigger (username or first name).
         */
        @Nullable
        @JsonProperty("displayName")
        String displayName,

        /**
         * Command text or encoded navigation token.
         */
        @NotBlank(message = "payload must not be blank")
        @JsonProperty("payload")
        String payload,

        /**
         * Transport handle used to acknowledge a menu selection or show an alert.
         */
        @Nullable
        @JsonProperty("callbackId")
        String callbackId

) {

    public boolean isCommand() {
        return payload != null && payload.startsWith("/");
    }

    public String displayNameOrId() {
        return displayName == null || displayName.isBlank() ? String.valueOf(userId) : displayName;
    }
}
