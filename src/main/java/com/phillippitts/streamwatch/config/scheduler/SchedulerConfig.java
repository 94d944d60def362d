package com.phillippitts.streamwatch.config.scheduler;

import com.phillippitts.streamwatch.config.properties.NotificationProperties;
import com.phillippitts.streamwatch.config.properties.PersistenceProperties;
import com.phillippitts.streamwatch.config.properties.ProbeProperties;
import com.phillippitts.streamwatch.config.properties.RecordingProperties;
import com.phillippitts.streamwatch.config.properties.SchedulerProperties;
import com.phillippitts.streamwatch.service.channel.ChannelService;
import com.phillippitts.streamwatch.service.disk.DiskSpaceGuard;
import com.phillippitts.streamwatch.service.disk.RecordingGate;
import com.phillippitts.streamwatch.service.metrics.SchedulerMetrics;
import com.phillippitts.streamwatch.service.notify.LiveNotificationService;
import com.phillippitts.streamwatch.service.notify.MessagePusher;
import com.phillippitts.streamwatch.service.notify.Notifier;
import com.phillippitts.streamwatch.service.persistence.ChannelStore;
import com.phillippitts.streamwatch.service.predict.LivenessPredictor;
import com.phillippitts.streamwatch.service.probe.LivenessProber;
import com.phillippitts.streamwatch.service.probe.PlatformPermits;
import com.phillippitts.streamwatch.service.probe.ResumeCheckListener;
import com.phillippitts.streamwatch.service.probe.Sleeper;
import com.phillippitts.streamwatch.service.recording.RecordingSessionManager;
import com.phillippitts.streamwatch.service.recording.StreamRecorder;
import com.phillippitts.streamwatch.service.registry.ChannelRegistry;
import com.phillippitts.streamwatch.service.registry.DebouncedTaskExecutor;
import com.phillippitts.streamwatch.service.resolver.StreamResolver;
import com.phillippitts.streamwatch.service.schedule.LaneQueues;
import com.phillippitts.streamwatch.service.schedule.LaneWorkerPool;
import com.phillippitts.streamwatch.service.schedule.LivenessDispatcher;
import com.phillippitts.streamwatch.service.schedule.LivenessHeartbeat;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.Executor;

/**
 * Wires the liveness scheduler: registry, predictor, prober, dispatcher, lane workers and heartbeat.
 * Shared dependencies come in through the constructor; bean methods take only the beans they add.
 */
@Configuration
public class SchedulerConfig {

    private final SchedulerProperties schedulerProperties;
    private final ProbeProperties probeProperties;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public SchedulerConfig(SchedulerProperties schedulerProperties,
                           ProbeProperties probeProperties,
                           ApplicationEventPublisher publisher,
                           Clock clock) {
        this.schedulerProperties = schedulerProperties;
        this.probeProperties = probeProperties;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Registry loaded from the channel store at startup. A store that cannot be read fails the start instead of
     * being overwritten by the first save.
     */
    @Bean(destroyMethod = "close")
    public ChannelRegistry channelRegistry(ChannelStore store, PersistenceProperties persistenceProperties) {
        DebouncedTaskExecutor persistExecutor =
                new DebouncedTaskExecutor("channel-persist", persistenceProperties.getDebounceMs());
        ChannelRegistry registry = new ChannelRegistry(store, persistExecutor, publisher, clock);
        registry.loadFromStore(schedulerProperties.getLoopTimeSeconds());
        return registry;
    }

    @Bean
    public LivenessPredictor livenessPredictor() {
        return new LivenessPredictor(clock);
    }

    @Bean
    public SchedulerMetrics schedulerMetrics(MeterRegistry meterRegistry) {
        return new SchedulerMetrics(meterRegistry);
    }

    @Bean
    public PlatformPermits platformPermits() {
        return new PlatformPermits(probeProperties.getPlatformMaxConcurrent(),
                probeProperties.getPermitTimeoutSeconds() * 1000L);
    }

    @Bean
    public RecordingGate recordingGate(DiskSpaceGuard guard, RecordingProperties recordingProperties) {
        return new RecordingGate(guard, recordingProperties.getOutputDir(),
                recordingProperties.getSpaceThresholdGb(), publisher, clock);
    }

    @Bean
    public LiveNotificationService liveNotificationService(Notifier notifier,
                                                           MessagePusher pusher,
                                                           NotificationProperties notificationProperties,
                                                           @Qualifier("eventExecutor") Executor eventExecutor) {
        return new LiveNotificationService(notifier, pusher, notificationProperties, eventExecutor, clock);
    }

    @Bean
    public RecordingSessionManager recordingSessionManager(StreamRecorder recorder, ChannelRegistry registry) {
        return new RecordingSessionManager(recorder, registry, publisher, clock);
    }

    @Bean
    public LivenessProber livenessProber(StreamResolver resolver,
                                         PlatformPermits permits,
                                         RecordingSessionManager sessions,
                                         LiveNotificationService notifications,
                                         RecordingGate recordingGate,
                                         ChannelRegistry registry,
                                         SchedulerMetrics metrics) {
        return new LivenessProber(resolver, permits, sessions, notifications, recordingGate, registry,
                publisher, metrics, schedulerProperties, probeProperties, clock, Sleeper.SYSTEM);
    }

    @Bean
    public ResumeCheckListener resumeCheckListener(ChannelRegistry registry, LivenessProber prober,
                                                   @Qualifier("eventExecutor") Executor eventExecutor) {
        return new ResumeCheckListener(registry, prober, eventExecutor);
    }

    @Bean
    public LaneQueues laneQueues() {
        return new LaneQueues();
    }

    @Bean
    public LivenessDispatcher livenessDispatcher(ChannelRegistry registry,
                                                 LivenessPredictor predictor,
                                                 LaneQueues queues,
                                                 SchedulerMetrics metrics) {
        return new LivenessDispatcher(registry, predictor, queues, metrics, schedulerProperties, clock,
                new Random());
    }

    @Bean
    public LaneWorkerPool laneWorkerPool(LaneQueues queues, LivenessProber prober, ChannelRegistry registry,
                                         @Qualifier("laneWorkerExecutor") ThreadPoolTaskExecutor executor) {
        return new LaneWorkerPool(queues, prober, registry, executor);
    }

    @Bean
    public LivenessHeartbeat livenessHeartbeat(LivenessDispatcher dispatcher, RecordingGate recordingGate) {
        return new LivenessHeartbeat(dispatcher, recordingGate, schedulerProperties, clock);
    }

    @Bean
    public ChannelService channelService(ChannelRegistry registry,
                                         LivenessProber prober,
                                         RecordingSessionManager sessions,
                                         LivenessPredictor predictor,
                                         @Qualifier("eventExecutor") Executor eventExecutor) {
        return new ChannelService(registry, prober, sessions, predictor, schedulerProperties, eventExecutor,
                clock);
    }
}
