package com.keystone.agenttemplate.infrastructure.web;

import com.keystone.agenttemplate.api.AgentController;
import com.keystone.agenttemplate.config.AgentTemplateProperties;
import com.keystone.utilities.logging.CorrelationContext;
import com.keystone.utilities.logging.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates the {@code X-Correlation-ID} of every HTTP request and installs a
 * {@link CorrelationContext} for the duration of the request. The ID is echoed on the response
 * and becomes the agent request ID.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private final String serviceName;

    public CorrelationIdFilter(AgentTemplateProperties properties) {
        this.serviceName = properties.name();
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(new CorrelationContext(correlationId, serviceName,
                request.getHeader(AgentController.TENANT_HEADER),
                request.getHeader(AgentController.USER_HEADER),
                request.getMethod() + " " + request.getRequestURI()));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
