package com.phillippitts.streamwatch.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID</li>
 *   <li>userId: from X-User-ID header (if present)</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request URI</li>
 *   <li>channelId: for {@code /api/channels/{id}/...} requests</li>
 * </ul>
 *
 * <p>The context is always cleared after the request to avoid leakage across threads.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    private static final String REQUEST_ID_HEADER = "X-Request-ID";
    private static final String USER_ID_HEADER = "X-User-ID";
    private static final Pattern CHANNEL_PATH = Pattern.compile("^/api/channels/([^/]+)");
    // Batch endpoints directly under /api/channels; not channel ids.
    private static final Set<String> COLLECTION_SEGMENTS = Set.of("start", "stop", "remove", "start-all", "stop-all");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                ThreadContext.put("requestId", headerOrGenerate(http, REQUEST_ID_HEADER));

                String userId = http.getHeader(USER_ID_HEADER);
                if (userId != null && !userId.isBlank()) {
                    ThreadContext.put("userId", userId);
                }

                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());

                String channelId = channelIdOf(http.getRequestURI());
                if (channelId != null) {
                    ThreadContext.put("channelId", channelId);
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static String channelIdOf(String uri) {
        if (uri == null) {
            return null;
        }
        Matcher m = CHANNEL_PATH.matcher(uri);
        if (!m.find()) {
            return null;
        }
        String id = m.group(1);
        return COLLECTION_SEGMENTS.contains(id) ? null : id;
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
