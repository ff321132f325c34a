package org.example.imagegen.config;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;

/**
 * Correlation keys shared by the HTTP filter, the error handler and the
 * generation workers. Both MDC keys are printed by the log pattern.
 */
public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String REQUEST_ID_KEY = "requestId";
    public static final String JOB_ID_KEY = "jobId";
    public static final String UNKNOWN = "unknown";
    static final int MAX_REQUEST_ID_LENGTH = 80;

    private RequestCorrelation() {
    }

    public static String resolveRequestId(HttpServletRequest request) {
        if (request != null) {
            Object requestId = request.getAttribute(REQUEST_ID_KEY);
            if (requestId instanceof String value && !value.isBlank()) {
                return value;
            }
        }
        String fromMdc = MDC.get(REQUEST_ID_KEY);
        return fromMdc == null || fromMdc.isBlank() ? UNKNOWN : fromMdc;
    }

    /**
     * Trim a client-supplied id and drop anything outside a conservative
     * character set so it is safe to echo and log.
     */
    static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = value.trim().replaceAll("[^A-Za-z0-9._:-]", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        if (cleaned.length() > MAX_REQUEST_ID_LENGTH) {
            cleaned = cleaned.substring(0, MAX_REQUEST_ID_LENGTH);
        }
        return cleaned;
    }
}
