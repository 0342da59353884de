package com.phillippitts.webpbatch.config.logging;

import com.phillippitts.webpbatch.service.run.ConversionRunService;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Objects;
import java.util.UUID;

/**
 * Adds request-scoped values to Log4j2's MDC (ThreadContext) for structured logging.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: from X-Request-ID header, or generated UUID; echoed back in the response</li>
 *   <li>runId: for requests on the current run, the id of the run still active; echoed back
 *       as X-Run-ID</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request URI</li>
 * </ul>
 *
 * <p>The context is always cleared after the request to avoid leakage across threads.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String RUN_ID_HEADER = "X-Run-ID";
    private static final String CURRENT_RUN_PATH = "/api/runs/current";

    private final ConversionRunService runService;

    public MdcFilter(ConversionRunService runService) {
        this.runService = Objects.requireNonNull(runService, "runService must not be null");
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                HttpServletResponse httpResponse =
                        response instanceof HttpServletResponse r ? r : null;
                String requestId = headerOrGenerate(http, REQUEST_ID_HEADER);
                ThreadContext.put("requestId", requestId);
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
                if (httpResponse != null) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }
                if (targetsCurrentRun(http)) {
                    runService.activeRunId().ifPresent(runId -> {
                        ThreadContext.put("runId", runId);
                        if (httpResponse != null) {
                            httpResponse.setHeader(RUN_ID_HEADER, runId);
                        }
                    });
                }
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static boolean targetsCurrentRun(HttpServletRequest req) {
        String uri = req.getRequestURI();
        return uri != null && (uri.equals(CURRENT_RUN_PATH) || uri.startsWith(CURRENT_RUN_PATH + "/"));
    }

    private static String headerOrGenerate(HttpServletRequest req, String headerName) {
        String v = req.getHeader(headerName);
        return (v == null || v.isBlank()) ? UUID.randomUUID().toString() : v;
    }
}
