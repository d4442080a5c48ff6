package io.newsclusters.digest.config;

public record ScheduleConfig(
        boolean enabled,
        String dailyCron,
        String zone
) {}
