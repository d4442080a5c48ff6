package io.newsclusters.digest.api.dto;

public record DigestRequest(
        String topic,
        String location,
        String language
) {}
