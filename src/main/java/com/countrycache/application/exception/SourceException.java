package com.countrycache.application.exception;

import lombok.Getter;

/**
 * Failure to obtain a complete, well-formed response from an external data source.
 * Any source failure aborts the whole refresh before storage is touched.
 */
@Getter
public class SourceException extends RuntimeException {

    public enum Kind {
        UNAVAILABLE,
        TIMEOUT,
        MALFORMED
    }

    private final String sourceName;
    private final Kind kind;

    public SourceException(String sourceName, Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
        this.kind = kind;
    }

    public static SourceException unavailable(String sourceName, String reason) {
        return new SourceException(sourceName, Kind.UNAVAILABLE,
                "Could not fetch data from " + sourceName + ": " + reason, null);
    }

    public static SourceException unavailable(String sourceName, Throwable cause) {
        return new SourceException(sourceName, Kind.UNAVAILABLE,
                "Could not fetch data from " + sourceName, cause);
    }

    public static SourceException timeout(String sourceName, Throwable cause) {
        return new SourceException(sourceName, Kind.TIMEOUT,
                "Timed out fetching data from " + sourceName, cause);
    }

    public static SourceException malformed(String sourceName, String reason) {
        return new SourceException(sourceName, Kind.MALFORMED,
                "Unexpected response from " + sourceName + ": " + reason, null);
    }

    public static SourceException malformed(String sourceName, Throwable cause) {
        return new SourceException(sourceName, Kind.MALFORMED,
                "Unexpected response from " + sourceName + ": " + cause.getMessage(), cause);
    }
}
