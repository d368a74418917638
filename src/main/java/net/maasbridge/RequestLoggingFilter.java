/**
 * Request logging and timing filter for HTTP requests
 *
 * @author William Callahan
 *
 * Features:
 * - Logs /api and /admin requests with method, URI and source IP
 * - Logs status and duration once the servlet dispatch returns
 * - Tags each request with a short id in the logging MDC and the X-Request-Id header
 */
package net.maasbridge;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import net.maasbridge.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

@Component
public class RequestLoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    static final String REQUEST_ID_KEY = "requestId";
    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final List<String> LOGGED_PREFIXES = List.of("/api", "/admin");

    /**
     * Logs and times bridge requests; anything outside {@code /api} and {@code /admin} passes through.
     * The request id is echoed as {@code X-Request-Id} and is visible to log lines via the MDC.
     *
     * @throws IOException If an I/O error occurs during request processing
     * @throws ServletException If a servlet error occurs during processing
     */
    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest httpRequest)
                || !(response instanceof HttpServletResponse httpResponse)
                || !isLogged(httpRequest.getRequestURI())) {
            chain.doFilter(request, response);
            return;
        }

        String requestId = IdGenerator.requestId();
        long startNanos = System.nanoTime();
        MDC.put(REQUEST_ID_KEY, requestId);
        httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            logger.info("{} {}{} from {}", httpRequest.getMethod(), httpRequest.getRequestURI(),
                    httpRequest.getQueryString() == null ? "" : "?" + httpRequest.getQueryString(),
                    httpRequest.getRemoteAddr());
            chain.doFilter(request, response);
        } finally {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            logger.info("{} {} -> {} in {} ms{}", httpRequest.getMethod(), httpRequest.getRequestURI(),
                    httpResponse.getStatus(), durationMs, request.isAsyncStarted() ? " (async)" : "");
            MDC.remove(REQUEST_ID_KEY);
        }
    }

    private static boolean isLogged(String uri) {
        return uri != null && LOGGED_PREFIXES.stream().anyMatch(uri::startsWith);
    }
}
