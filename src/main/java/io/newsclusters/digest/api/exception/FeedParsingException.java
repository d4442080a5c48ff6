package io.newsclusters.digest.api.exception;

public class FeedParsingException extends Exception {
    private final ErrorCategory category;

    public FeedParsingException(String message, ErrorCategory category) {
        super(message);
        this.category = category;
    }

    public FeedParsingException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
