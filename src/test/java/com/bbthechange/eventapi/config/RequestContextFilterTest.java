package com.bbthechange.eventapi.config;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestContextFilterTest {

    private RequestContextFilter filter;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        filter = new RequestContextFilter();
        request = new MockHttpServletRequest("GET", "/events");
        response = new MockHttpServletResponse();
    }

    @Test
    void doFilter_WithHeader_PropagatesRequestId() throws Exception {
        request.addHeader(RequestContextFilter.REQUEST_ID_HEADER, "req-42");
        AtomicReference<String> seenInChain = new AtomicReference<>();
        FilterChain chain = (req, res) -> seenInChain.set(MDC.get(RequestContextFilter.MDC_REQUEST_ID));

        filter.doFilter(request, response, chain);

        assertThat(seenInChain.get()).isEqualTo("req-42");
        assertThat(response.getHeader(RequestContextFilter.REQUEST_ID_HEADER)).isEqualTo("req-42");
        assertThat(MDC.get(RequestContextFilter.MDC_REQUEST_ID)).isNull();
    }

    @Test
    void doFilter_WithoutHeader_GeneratesRequestId() throws Exception {
        filter.doFilter(request, response, (req, res) -> { });

        assertThat(response.getHeader(RequestContextFilter.REQUEST_ID_HEADER))
            .isNotBlank()
            .hasSize(36);
    }

    @Test
    void doFilter_ChainFails_StillClearsMdc() {
        FilterChain chain = (req, res) -> {
            throw new IllegalStateException("boom");
        };

        assertThatThrownBy(() -> filter.doFilter(request, response, chain)).isInstanceOf(IllegalStateException.class);
        assertThat(MDC.get(RequestContextFilter.MDC_REQUEST_ID)).isNull();
    }

    @Test
    void resolveRequestId_OverlongHeader_IsReplaced() {
        String overlong = "x".repeat(200);

        assertThat(RequestContextFilter.resolveRequestId(overlong)).isNotEqualTo(overlong).hasSize(36);
        assertThat(RequestContextFilter.resolveRequestId("  abc  ")).isEqualTo("abc");
        assertThat(RequestContextFilter.resolveRequestId(" ")).hasSize(36);
    }
}
