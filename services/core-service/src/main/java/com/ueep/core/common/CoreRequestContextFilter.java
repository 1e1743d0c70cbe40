package com.ueep.core.common;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CoreRequestContextFilter extends OncePerRequestFilter {
    public static final String CORRELATION_HEADER = "X-Correlation-ID";
    public static final String MDC_KEY = "correlation_id";

    private static final Logger logger = LoggerFactory.getLogger(CoreRequestContextFilter.class);

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        String correlationId = IdGenerator.resolveCorrelationId(request.getHeader(CORRELATION_HEADER));

        RequestContextHolder.set(new RequestContext(correlationId, System.nanoTime()));
        MDC.put(MDC_KEY, correlationId);
        response.setHeader(CORRELATION_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            long latencyMs = elapsedMs(RequestContextHolder.get());
            logger.info(
                "correlation_id={} method={} path={} status={} latency_ms={}",
                correlationId,
                request.getMethod(),
                request.getRequestURI(),
                response.getStatus(),
                latencyMs
            );
            MDC.remove(MDC_KEY);
            RequestContextHolder.clear();
        }
    }

    private static long elapsedMs(RequestContext context) {
        if (context == null) {
            return 0L;
        }
        return (System.nanoTime() - context.getStartedAtNs()) / 1_000_000L;
    }
}
