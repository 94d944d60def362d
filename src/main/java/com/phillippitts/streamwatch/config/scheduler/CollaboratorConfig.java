package com.phillippitts.streamwatch.config.scheduler;

import com.phillippitts.streamwatch.config.properties.PersistenceProperties;
import com.phillippitts.streamwatch.service.disk.DiskSpaceGuard;
import com.phillippitts.streamwatch.service.disk.FileStoreDiskSpaceGuard;
import com.phillippitts.streamwatch.service.notify.LoggingNotifier;
import com.phillippitts.streamwatch.service.notify.MessagePusher;
import com.phillippitts.streamwatch.service.notify.Notifier;
import com.phillippitts.streamwatch.service.persistence.ChannelStore;
import com.phillippitts.streamwatch.service.persistence.JsonFileChannelStore;
import com.phillippitts.streamwatch.service.recording.StreamRecorder;
import com.phillippitts.streamwatch.service.recording.UnconfiguredStreamRecorder;
import com.phillippitts.streamwatch.service.resolver.StreamResolver;
import com.phillippitts.streamwatch.service.resolver.UnconfiguredStreamResolver;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Default implementations of the scheduler's external collaborators. Each one backs off as soon as the
 * application defines its own bean of the same type.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public StreamResolver streamResolver() {
        return new UnconfiguredStreamResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public StreamRecorder streamRecorder() {
        return new UnconfiguredStreamRecorder();
    }

    @Bean
    @ConditionalOnMissingBean
    public Notifier notifier() {
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public MessagePusher messagePusher() {
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public DiskSpaceGuard diskSpaceGuard() {
        return new FileStoreDiskSpaceGuard();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChannelStore channelStore(PersistenceProperties properties, Clock clock) {
        return new JsonFileChannelStore(Path.of(properties.getFile()), clock.getZone());
    }
}
