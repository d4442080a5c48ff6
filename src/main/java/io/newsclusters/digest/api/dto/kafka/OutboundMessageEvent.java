package io.newsclusters.digest.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record OutboundMessageEvent(
        @JsonProperty("messageId") String messageId,
        @JsonProperty("chatId") long chatId,
        @JsonProperty("sequence") long sequence,
        @JsonProperty("text") String text,
        @JsonProperty("parseMode") String parseMode,
        @JsonProperty("disableWebPagePreview") boolean disableWebPagePreview,
        @JsonProperty("createdAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime createdAt
) {
    public static final String MARKDOWN_V2 = "MarkdownV2";

    public static OutboundMessageEvent create(long chatId, long sequence, String text,
                                              String parseMode, boolean disableWebPagePreview) {
        return new OutboundMessageEvent(
                "MSG-" + java.util.UUID.randomUUID().toString().substring(0, 8),
                chatId, sequence, text, parseMode, disableWebPagePreview, LocalDateTime.now()
        );
    }
}
