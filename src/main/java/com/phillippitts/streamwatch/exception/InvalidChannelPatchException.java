package com.phillippitts.streamwatch.exception;

/**
 * Thrown when a channel patch names an unknown field or carries a value of the wrong type.
 */
public class InvalidChannelPatchException extends StreamWatchException {

    private final String field;

    public InvalidChannelPatchException(String field, String reason) {
        super("Invalid channel patch field '" + field + "': " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
