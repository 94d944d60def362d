package com.phillippitts.streamwatch.service.probe;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

/**
 * Derives the platform key used to scope probe permits from a channel URL: the lower-cased host without a
 * leading {@code www.}, {@code m.} or {@code live.} label.
 */
public final class PlatformKeys {

    public static final String UNKNOWN = "unknown";

    private static final List<String> DROPPED_PREFIXES = List.of("www.", "m.", "live.");

    private PlatformKeys() {}

    public static String fromUrl(String url) {
        if (url == null || url.isBlank()) {
            return UNKNOWN;
        }
        String candidate = url.trim();
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }
        String host;
        try {
            host = new URI(candidate).getHost();
        } catch (URISyntaxException e) {
            return UNKNOWN;
        }
        if (host == null || host.isBlank()) {
            return UNKNOWN;
        }
        host = host.toLowerCase(Locale.ROOT);
        for (String prefix : DROPPED_PREFIXES) {
            if (host.startsWith(prefix) && host.length() > prefix.length()) {
                host = host.substring(prefix.length());
                break;
            }
        }
        return host;
    }
}
