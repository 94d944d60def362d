package com.phillippitts.streamwatch.service.notify;

import com.phillippitts.streamwatch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default notification sink: writes notifications and push messages to the log.
 */
public class LoggingNotifier implements Notifier, MessagePusher {

    private static final Logger LOG = LogManager.getLogger(LoggingNotifier.class);
    private static final int MAX_LOGGED_CHARS = 200;

    @Override
    public void notify(String title, String message) {
        LOG.info("[notify] {}: {}", title, LogSanitizer.truncate(message, MAX_LOGGED_CHARS));
    }

    @Override
    public void push(String title, String body) {
        LOG.info("[push] {}: {}", title, LogSanitizer.truncate(body, MAX_LOGGED_CHARS));
    }
}
