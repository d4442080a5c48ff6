package io.newsclusters.digest.api.dto;

public record UserSubscription(
        long chatId,
        String topic,
        String language,
        String location
) {}
