/**
 * Request logging and timing filter for API requests
 *
 * Features:
 * - Logs incoming /api requests with method, URI and source IP
 * - Measures and logs request processing duration with the response status
 * - Leaves every other path unlogged
 */
package net.shelfmatch;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class RequestLoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    /**
     * Times the request through the chain and logs start and completion for API paths.
     *
     * @param request The incoming servlet request
     * @param response The servlet response
     * @param chain The filter processing chain
     * @throws IOException If an I/O error occurs during request processing
     * @throws ServletException If a servlet error occurs during processing
     */
    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest req) || !req.getRequestURI().startsWith("/api")) {
            chain.doFilter(request, response);
            return;
        }
        String uri = req.getRequestURI();
        long startTime = System.currentTimeMillis();
        logger.info("Incoming request: {} {} from {}", req.getMethod(), uri, req.getRemoteAddr());
        try {
            chain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            int status = response instanceof HttpServletResponse httpResponse ? httpResponse.getStatus() : 0;
            logger.info("Completed request: {} {} with status {} in {} ms", req.getMethod(), uri, status, duration);
        }
    }
}
