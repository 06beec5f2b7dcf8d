package com.cloudwise.costanalytics.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds a trace id and the caller's optional series key to the request thread and the logging MDC.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Request-Trace";
    public static final String SERIES_HEADER = "X-Series-Key";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }
        String seriesKey = request.getHeader(SERIES_HEADER);
        if (seriesKey != null && seriesKey.isBlank()) {
            seriesKey = null;
        }
        RequestContextHolder.set(new RequestContextHolder.RequestContext(traceId, seriesKey));
        MDC.put("trace_id", traceId);
        if (seriesKey != null) {
            MDC.put("series", seriesKey);
        }
        response.setHeader(TRACE_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove("trace_id");
            MDC.remove("series");
            RequestContextHolder.clear();
        }
    }
}
