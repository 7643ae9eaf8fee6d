package com.forecastalpha.analysis.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    void bindsIncomingTraceIdForTheDurationOfTheRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/analyze/dataset");
        request.addHeader(TraceIdFilter.TRACE_HEADER, "trace-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<RequestContextHolder.RequestContext> seen = new AtomicReference<>();
        AtomicReference<String> mdc = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> {
            seen.set(RequestContextHolder.get().orElseThrow());
            mdc.set(MDC.get(TraceIdFilter.MDC_KEY));
        });

        assertThat(seen.get().traceId()).isEqualTo("trace-123");
        assertThat(seen.get().method()).isEqualTo("POST");
        assertThat(seen.get().path()).isEqualTo("/api/analyze/dataset");
        assertThat(mdc.get()).isEqualTo("trace-123");
        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo("trace-123");
        assertThat(RequestContextHolder.get()).isEmpty();
        assertThat(MDC.get(TraceIdFilter.MDC_KEY)).isNull();
    }

    @Test
    void generatesTraceIdWhenHeaderIsBlank() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        request.addHeader(TraceIdFilter.TRACE_HEADER, " ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(RequestContextHolder.traceId().orElse(null)));

        assertThat(seen.get()).isNotBlank().isEqualTo(response.getHeader(TraceIdFilter.TRACE_HEADER));
    }
}
