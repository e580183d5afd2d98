package com.ceiling.quotaservice.infrastructure.web;

import com.ceiling.observability.CorrelationContext;
import com.ceiling.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that propagates or generates a correlation ID for every HTTP request and binds the
 * forwarded caller to it.
 *
 * <p>WHY: Every quota decision is logged with the correlation ID, organization and user of the
 * request that asked for it, including lines written by usage reporters on pool threads. The values
 * flow:
 *
 * <ol>
 *   <li>HTTP request headers → this filter → {@link CorrelationContextHolder}
 *   <li>CorrelationContextHolder → SLF4J MDC → log output
 *   <li>This filter → HTTP response header (for client-side correlation)
 * </ol>
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so correlation is available to all subsequent
 * filters and handlers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Pattern SAFE_CORRELATION_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || !SAFE_CORRELATION_ID.matcher(correlationId).matches()) {
            correlationId = UUID.randomUUID().toString();
        }

        // Header values end up in every log line: only canonical ids go into MDC.
        var context = new CorrelationContext(
                correlationId,
                CallerHeaders.loggableId(request.getHeader(CallerHeaders.ORG_ID_HEADER)),
                CallerHeaders.loggableId(request.getHeader(CallerHeaders.USER_ID_HEADER)),
                UUID.randomUUID().toString());
        CorrelationContextHolder.set(context);

        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads.
            CorrelationContextHolder.clear();
        }
    }
}
