/**
 * Log4j2 MDC (ThreadContext) support.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId}, {@code participantId}, {@code method}, {@code uri} - set per HTTP
 *       request by {@link com.phillippitts.collabscribe.config.logging.CollaborationMdcFilter}</li>
 *   <li>{@code sessionId} - set while a session command runs</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2026-03-02 15:42:32.529 [session-cmd-1] [requestId] [sessionId] LEVEL logger.name - message
 * </pre>
 */
package com.phillippitts.collabscribe.config.logging;
