package com.phillippitts.streamwatch.service.notify;

import com.phillippitts.streamwatch.config.properties.NotificationProperties;
import com.phillippitts.streamwatch.domain.ChannelState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Sends live-start and stream-end notifications for channels.
 *
 * <p>Delivery runs on the supplied executor; failures are logged and never reach the caller. Push messages are
 * sent at most once per live session, tracked by the channel's notified-start and notified-end flags.
 */
public class LiveNotificationService {

    private static final Logger LOG = LogManager.getLogger(LiveNotificationService.class);
    private static final DateTimeFormatter PUSH_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    static final String DESKTOP_TITLE = "Notify";
    static final String DESKTOP_MESSAGE = "Live recording started";

    private final Notifier notifier;
    private final MessagePusher pusher;
    private final NotificationProperties properties;
    private final Executor executor;
    private final Clock clock;

    public LiveNotificationService(Notifier notifier, MessagePusher pusher, NotificationProperties properties,
                                   Executor executor, Clock clock) {
        this.notifier = notifier;
        this.pusher = pusher;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    /** Desktop notification for an offline-to-live transition. */
    public void notifyLiveStart(ChannelState channel) {
        if (!properties.isDesktopEnabled()) {
            return;
        }
        String message = channel.getConfig().displayName() + " | " + DESKTOP_MESSAGE;
        deliver("desktop", () -> notifier.notify(DESKTOP_TITLE, message));
    }

    /**
     * Sends the live-start push message unless it already went out for this session.
     *
     * @return true if a message was queued for delivery
     */
    public boolean pushLiveStart(ChannelState channel) {
        if (channel.isNotifiedLiveStart() || !properties.isPushStartEnabled()
                || !channel.getConfig().messagePushEnabled()) {
            return false;
        }
        String body = render(properties.getStartTemplate(), channel);
        String title = properties.effectiveTitle();
        channel.setNotifiedLiveStart(true);
        deliver("push-start", () -> pusher.push(title, body));
        return true;
    }

    /**
     * Sends the stream-end push message unless it already went out for this session.
     *
     * @return true if a message was queued for delivery
     */
    public boolean pushLiveEnd(ChannelState channel) {
        if (channel.isNotifiedLiveEnd() || !properties.isPushEndEnabled()
                || !channel.getConfig().messagePushEnabled()) {
            return false;
        }
        String body = render(properties.getEndTemplate(), channel);
        String title = properties.effectiveTitle();
        channel.setNotifiedLiveEnd(true);
        deliver("push-end", () -> pusher.push(title, body));
        return true;
    }

    String render(String template, ChannelState channel) {
        String title = channel.getLiveTitle();
        return template
                .replace("[room_name]", channel.getConfig().displayName())
                .replace("[time]", LocalDateTime.now(clock).format(PUSH_TIME))
                .replace("[title]", title == null ? "None" : title);
    }

    private void deliver(String kind, Runnable delivery) {
        try {
            executor.execute(() -> {
                try {
                    delivery.run();
                } catch (RuntimeException e) {
                    LOG.warn("Notification delivery failed ({}): {}", kind, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Notification dropped ({}): executor rejected the task", kind);
        }
    }
}
