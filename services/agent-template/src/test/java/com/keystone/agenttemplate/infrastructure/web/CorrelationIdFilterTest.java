package com.keystone.agenttemplate.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.keystone.agenttemplate.config.AgentTemplateProperties;
import com.keystone.utilities.logging.CorrelationContext;
import com.keystone.utilities.logging.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter(
            new AgentTemplateProperties("echo-agent", null, null, null, null, null));

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates correlation ID when none provided")
    void generatesCorrelationIdWhenNoneProvided() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, resp) -> { });

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("propagates existing correlation ID from header")
    void propagatesExistingCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "test-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> { });

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("installs tenant and user context during the chain and clears it afterwards")
    void scopesContextToRequest() throws Exception {
        var request = new MockHttpServletRequest("POST", "/api/v1/agent/echo");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-1");
        request.addHeader("X-Tenant-ID", "acme");
        request.addHeader("X-User-ID", "alice");
        AtomicReference<CorrelationContext> seen = new AtomicReference<>();
        AtomicReference<String> seenMdcTenant = new AtomicReference<>();
        FilterChain chain = (req, resp) -> {
            seen.set(CorrelationContextHolder.get().orElse(null));
            seenMdcTenant.set(MDC.get(CorrelationContext.MDC_TENANT_ID));
        };

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(seen.get()).isEqualTo(new CorrelationContext("corr-1", "echo-agent", "acme", "alice",
                "POST /api/v1/agent/echo"));
        assertThat(seenMdcTenant.get()).isEqualTo("acme");
        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
