package com.phillippitts.streamwatch;

import com.phillippitts.streamwatch.config.properties.NotificationProperties;
import com.phillippitts.streamwatch.config.properties.PersistenceProperties;
import com.phillippitts.streamwatch.config.properties.ProbeProperties;
import com.phillippitts.streamwatch.config.properties.RecordingProperties;
import com.phillippitts.streamwatch.config.properties.SchedulerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SchedulerProperties.class,
        ProbeProperties.class,
        PersistenceProperties.class,
        RecordingProperties.class,
        NotificationProperties.class
})
@EnableScheduling
public class StreamWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamWatchApplication.class, args);
    }

}
