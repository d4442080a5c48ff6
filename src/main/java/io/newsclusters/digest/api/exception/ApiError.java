package io.newsclusters.digest.api.exception;

import java.time.LocalDateTime;

public record ApiError(
        int status,
        String error,
        String path,
        LocalDateTime timestamp
) {}
