package com.phillippitts.streamwatch.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Live-start and stream-end notification settings.
 *
 * <p>Templates accept the placeholders {@code [room_name]}, {@code [time]} and {@code [title]}.
 */
@ConfigurationProperties(prefix = "streamwatch.notification")
public class NotificationProperties {

    private boolean desktopEnabled = true;
    private boolean pushStartEnabled = true;
    private boolean pushEndEnabled = false;
    private String title = "";
    private String startTemplate = "[room_name] is live: [title] ([time])";
    private String endTemplate = "[room_name] has ended the stream ([time])";

    /** Title used for push messages; falls back to "Live status" when blank. */
    public String effectiveTitle() {
        return title == null || title.isBlank() ? "Live status" : title.trim();
    }

    public boolean isDesktopEnabled() {
        return desktopEnabled;
    }

    public void setDesktopEnabled(boolean desktopEnabled) {
        this.desktopEnabled = desktopEnabled;
    }

    public boolean isPushStartEnabled() {
        return pushStartEnabled;
    }

    public void setPushStartEnabled(boolean pushStartEnabled) {
        this.pushStartEnabled = pushStartEnabled;
    }

    public boolean isPushEndEnabled() {
        return pushEndEnabled;
    }

    public void setPushEndEnabled(boolean pushEndEnabled) {
        this.pushEndEnabled = pushEndEnabled;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getStartTemplate() {
        return startTemplate;
    }

    public void setStartTemplate(String startTemplate) {
        this.startTemplate = startTemplate;
    }

    public String getEndTemplate() {
        return endTemplate;
    }

    public void setEndTemplate(String endTemplate) {
        this.endTemplate = endTemplate;
    }
}
