package dev.guardrails.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the manual trigger endpoints with the X-Operator-Api-Key header.
 * Only applies to /trigger/** paths. With no key configured the endpoints are open.
 */
public class OperatorApiKeyFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(OperatorApiKeyFilter.class);
    static final String OPERATOR_API_KEY_HEADER = "X-Operator-Api-Key";

    private final String operatorApiKey;

    public OperatorApiKeyFilter(String operatorApiKey) {
        this.operatorApiKey = operatorApiKey;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/trigger/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (operatorApiKey == null || operatorApiKey.isBlank()) {
            log.debug("Operator API key not configured, allowing {}", request.getRequestURI());
            filterChain.doFilter(request, response);
            return;
        }

        String providedKey = request.getHeader(OPERATOR_API_KEY_HEADER);

        if (providedKey == null || providedKey.isBlank()) {
            reject(response, "Missing " + OPERATOR_API_KEY_HEADER + " header");
            return;
        }

        if (!MessageDigest.isEqual(operatorApiKey.getBytes(StandardCharsets.UTF_8),
                providedKey.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected manual trigger with invalid operator key: {}", request.getRequestURI());
            reject(response, "Invalid operator API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private static void reject(HttpServletResponse response, String reason) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.getWriter().write("{\"status\":\"rejected\",\"reason\":\"" + reason + "\"}");
    }
}
