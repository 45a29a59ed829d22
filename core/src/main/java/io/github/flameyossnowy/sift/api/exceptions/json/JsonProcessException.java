package io.github.flameyossnowy.sift.api.exceptions.json;

/**
 * Thrown when a filter payload cannot be bound or written.
 * <p>
 * The message ends with the payload position when the parser reported one.
 */
public class JsonProcessException extends RuntimeException {
    private final JsonLocation location;

    public JsonProcessException(String message, JsonLocation location) {
        super(message);
        this.location = location == null ? JsonLocation.UNKNOWN : location;
    }

    public JsonProcessException(String message, Throwable cause, JsonLocation location) {
        super(message, cause);
        this.location = location == null ? JsonLocation.UNKNOWN : location;
    }

    public JsonLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (location.lineNumber() < 0) {
            return message;
        }
        return message + " (line " + location.lineNumber() + ", column " + location.columnNumber() + ')';
    }
}
