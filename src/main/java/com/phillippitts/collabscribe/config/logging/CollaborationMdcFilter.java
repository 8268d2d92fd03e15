package com.phillippitts.collabscribe.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;

/**
 * Seeds Log4j2's MDC (ThreadContext) for every HTTP call into the collaboration API.
 *
 * <p>Keys:</p>
 * <ul>
 *   <li>requestId: X-Request-ID, or a generated UUID; echoed back on the response</li>
 *   <li>participantId: X-Participant-ID, when the caller speaks for one participant</li>
 *   <li>sessionId: X-Session-ID, sent by peers forwarding segments of a running session; ignored
 *       unless it is a UUID</li>
 *   <li>method, uri</li>
 * </ul>
 *
 * <p>Whatever context the serving thread carried before the request is put back afterwards.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CollaborationMdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String PARTICIPANT_ID_HEADER = "X-Participant-ID";
    static final String SESSION_ID_HEADER = "X-Session-ID";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }
        Map<String, String> previous = ThreadContext.getImmutableContext();
        try {
            String requestId = header(http, REQUEST_ID_HEADER);
            if (requestId == null) {
                requestId = UUID.randomUUID().toString();
            }
            ThreadContext.put("requestId", requestId);
            if (response instanceof HttpServletResponse httpResponse) {
                httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
            }

            putIfPresent("participantId", header(http, PARTICIPANT_ID_HEADER));
            putIfPresent("sessionId", sessionId(header(http, SESSION_ID_HEADER)));
            ThreadContext.put("method", http.getMethod());
            ThreadContext.put("uri", http.getRequestURI());

            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearMap();
            if (previous != null && !previous.isEmpty()) {
                ThreadContext.putAll(previous);
            }
        }
    }

    private static String header(HttpServletRequest request, String name) {
        String value = request.getHeader(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String sessionId(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return UUID.fromString(raw).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            ThreadContext.put(key, value);
        }
    }
}
