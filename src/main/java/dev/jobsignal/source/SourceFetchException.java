package dev.jobsignal.source;

import lombok.Getter;

/**
 * An adapter could not fetch a company's postings (HTTP error, timeout,
 * missing board identifier, unreadable response).
 */
@Getter
public class SourceFetchException extends RuntimeException {

    private final String platform;
    private final String companyName;

    public SourceFetchException(String platform, String companyName, String message) {
        super(message);
        this.platform = platform;
        this.companyName = companyName;
    }

    public SourceFetchException(String platform, String companyName, Throwable cause) {
        super(describe(cause), cause);
        this.platform = platform;
        this.companyName = companyName;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return (message == null || message.isBlank()) ? cause.getClass().getSimpleName() : message;
    }
}
