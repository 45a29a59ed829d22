package io.github.flameyossnowy.sift.api.exceptions.json;

/**
 * Position in a filter payload where binding failed.
 */
public record JsonLocation(int lineNumber, int columnNumber, long charOffset) {
    public static final JsonLocation UNKNOWN = new JsonLocation(-1, -1, -1);
}
