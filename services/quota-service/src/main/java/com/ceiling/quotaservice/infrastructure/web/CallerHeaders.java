package com.ceiling.quotaservice.infrastructure.web;

import com.ceiling.quota.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import java.util.regex.Pattern;

/**
 * Reads the caller identity forwarded by the gateway.
 *
 * <p>WHY: Authentication happens upstream. The gateway forwards the signed-in caller as
 * {@code X-Org-Id} and {@code X-User-Id}; a request without a user header is anonymous and is only
 * held to global limits.
 */
public final class CallerHeaders {

    public static final String ORG_ID_HEADER = "X-Org-Id";
    public static final String USER_ID_HEADER = "X-User-Id";

    private static final Pattern ID_PATTERN = Pattern.compile("\\d{1,18}");

    private CallerHeaders() {
        // utility class
    }

    /**
     * Builds the quota request context for the caller of {@code request}.
     *
     * @throws IllegalArgumentException if a header is present but not a non-negative number
     */
    public static RequestContext resolve(HttpServletRequest request) {
        String user = request.getHeader(USER_ID_HEADER);
        if (user == null || user.isBlank()) {
            return RequestContext.anonymous();
        }
        long userId = parseId(USER_ID_HEADER, user);
        long orgId = parseId(ORG_ID_HEADER, request.getHeader(ORG_ID_HEADER));
        return RequestContext.authenticated(orgId, userId);
    }

    /**
     * The header's id in canonical form for log context, or null when it is absent or not a valid
     * id. Never throws; {@link #resolve} rejects invalid ids when the request is handled.
     */
    public static String loggableId(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (!ID_PATTERN.matcher(trimmed).matches()) {
            return null;
        }
        return String.valueOf(Long.parseLong(trimmed));
    }

    static long parseId(String header, String value) {
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            long id = Long.parseLong(value.trim());
            if (id < 0) {
                throw new IllegalArgumentException(header + " must not be negative: " + value);
            }
            return id;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(header + " is not a valid id: " + value, e);
        }
    }
}
