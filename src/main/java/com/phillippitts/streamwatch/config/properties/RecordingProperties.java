package com.phillippitts.streamwatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Recording output settings. A {@code space-threshold-gb} of 0 disables the free-space guard.
 */
@ConfigurationProperties(prefix = "streamwatch.recording")
@Validated
public class RecordingProperties {

    @NotBlank
    private String outputDir = "./downloads";

    @PositiveOrZero
    private double spaceThresholdGb = 0;

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public double getSpaceThresholdGb() {
        return spaceThresholdGb;
    }

    public void setSpaceThresholdGb(double spaceThresholdGb) {
        this.spaceThresholdGb = spaceThresholdGb;
    }
}
