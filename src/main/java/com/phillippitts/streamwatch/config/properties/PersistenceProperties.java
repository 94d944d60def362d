package com.phillippitts.streamwatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Channel store location and write coalescing window.
 */
@ConfigurationProperties(prefix = "streamwatch.persistence")
@Validated
public class PersistenceProperties {

    @NotBlank
    private String file = "./config/channels.json";

    /** Save requests arriving within this window collapse into one write. */
    @Positive
    private long debounceMs = 2000;

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public long getDebounceMs() {
        return debounceMs;
    }

    public void setDebounceMs(long debounceMs) {
        this.debounceMs = debounceMs;
    }
}
