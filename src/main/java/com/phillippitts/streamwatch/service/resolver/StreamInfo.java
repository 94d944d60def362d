package com.phillippitts.streamwatch.service.resolver;

/**
 * Result of resolving a channel URL.
 *
 * <p>Offline is a normal result ({@code live=false}, no error). A result is complete only when it carries an
 * anchor name and no error; incomplete results are treated as check errors.
 *
 * @param live       whether the channel is on air
 * @param anchorName streamer name reported by the platform
 * @param title      current broadcast title (nullable)
 * @param error      failure description, null on success
 */
public record StreamInfo(boolean live, String anchorName, String title, String error) {

    public static StreamInfo live(String anchorName, String title) {
        return new StreamInfo(true, anchorName, title, null);
    }

    public static StreamInfo offline(String anchorName) {
        return new StreamInfo(false, anchorName, null, null);
    }

    public static StreamInfo failed(String error) {
        return new StreamInfo(false, null, null, error);
    }

    public boolean isComplete() {
        return error == null && anchorName != null && !anchorName.isBlank();
    }
}
