package com.phillippitts.streamwatch.service.resolver;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fallback resolver used when no platform integration is on the classpath. Every resolution fails, which keeps
 * channels in the check-error status instead of guessing.
 */
public class UnconfiguredStreamResolver implements StreamResolver {

    private static final Logger LOG = LogManager.getLogger(UnconfiguredStreamResolver.class);

    @Override
    public StreamInfo resolve(String url, String platformKey) {
        LOG.debug("No stream resolver configured for platform {}", platformKey);
        return StreamInfo.failed("no stream resolver configured for platform " + platformKey);
    }
}
