package com.ceiling.quotaservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.ceiling.observability.CorrelationContext;
import com.ceiling.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Unit tests for {@link CorrelationIdFilter}, run against servlet mocks without a Spring context.
 */
@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates correlation ID when none provided")
    void generatesCorrelationIdWhenNoneProvided() throws Exception {
        var request = new MockHttpServletRequest();
        var response = new MockHttpServletResponse();
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(request, response, chain);

        assertThat(response.getHeader("X-Correlation-ID")).isNotBlank();
    }

    @Test
    @DisplayName("propagates existing correlation ID from header")
    void propagatesExistingCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "test-abc-123");
        var response = new MockHttpServletResponse();
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(request, response, chain);

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("binds the forwarded caller to the context and MDC during the chain")
    void bindsCallerDuringChain() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        var capturedMdcOrg = new AtomicReference<String>();
        FilterChain capturingChain = (req, resp) -> {
            captured.set(CorrelationContextHolder.get().orElse(null));
            capturedMdcOrg.set(MDC.get(CorrelationContext.MDC_ORG_ID));
        };

        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "during-chain-123");
        request.addHeader(CallerHeaders.ORG_ID_HEADER, "3");
        request.addHeader(CallerHeaders.USER_ID_HEADER, "5");

        filter.doFilter(request, new MockHttpServletResponse(), capturingChain);

        assertThat(captured.get()).isNotNull();
        assertThat(captured.get().correlationId()).isEqualTo("during-chain-123");
        assertThat(captured.get().orgId()).isEqualTo("3");
        assertThat(captured.get().userId()).isEqualTo("5");
        assertThat(captured.get().requestId()).isNotBlank();
        assertThat(capturedMdcOrg.get()).isEqualTo("3");
    }

    @Test
    @DisplayName("keeps control characters in headers out of the log context")
    void keepsControlCharactersOutOfLogContext() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        FilterChain capturingChain = (req, resp) -> captured.set(CorrelationContextHolder.get().orElse(null));

        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "abc\r\n2025-01-01 INFO forged entry");
        request.addHeader(CallerHeaders.ORG_ID_HEADER, "3\r\nforged");
        request.addHeader(CallerHeaders.USER_ID_HEADER, " 0042 ");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, capturingChain);

        assertThat(captured.get().correlationId()).doesNotContain("\n").doesNotContain("forged");
        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo(captured.get().correlationId());
        assertThat(captured.get().orgId()).isNull();
        assertThat(captured.get().userId()).isEqualTo("42");
    }

    @Test
    @DisplayName("clears CorrelationContextHolder after request completes")
    void clearsCorrelationContextAfterRequest() throws Exception {
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), chain);

        assertThat(CorrelationContextHolder.get()).isEmpty();
        assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
    }
}
