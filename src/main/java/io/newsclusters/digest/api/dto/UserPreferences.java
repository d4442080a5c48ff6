package io.newsclusters.digest.api.dto;

public record UserPreferences(
        String topic,
        String language,
        String location,
        boolean automatic
) {
    public static final String DEFAULT_LANGUAGE = "en";
    public static final String DEFAULT_LOCATION = "US";

    public UserPreferences {
        language = language != null && !language.isBlank() ? language : DEFAULT_LANGUAGE;
        location = location != null && !location.isBlank() ? location : DEFAULT_LOCATION;
    }
}
