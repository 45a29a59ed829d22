package io.github.flameyossnowy.sift.api.exceptions.json;

public final class JacksonJsonLocation {
    private JacksonJsonLocation() {}

    public static JsonLocation from(com.fasterxml.jackson.core.JsonLocation location) {
        if (location == null) {
            return JsonLocation.UNKNOWN;
        }
        return new JsonLocation(location.getLineNr(), location.getColumnNr(), location.getCharOffset());
    }
}
