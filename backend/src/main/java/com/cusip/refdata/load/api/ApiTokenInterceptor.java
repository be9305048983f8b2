package com.cusip.refdata.load.api;

import com.cusip.refdata.config.LoaderProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Bearer token check for the job endpoints.
 */
@Component
public class ApiTokenInterceptor implements HandlerInterceptor {
    private static final Logger log = LoggerFactory.getLogger(ApiTokenInterceptor.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final LoaderProperties properties;
    private final ObjectMapper objectMapper;

    public ApiTokenInterceptor(LoaderProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        String expected = properties.getApi().getToken();
        if (expected == null || expected.isBlank()) {
            log.error("Rejecting {} {}: loader.api.token is not configured", request.getMethod(), request.getRequestURI());
            writeError(response, HttpStatus.INTERNAL_SERVER_ERROR, "token_not_configured", "API token not configured");
            return false;
        }
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        String presented = header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())
            ? header.substring(BEARER_PREFIX.length()).trim()
            : null;
        if (presented == null || !matches(expected.trim(), presented)) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
            writeError(response, HttpStatus.UNAUTHORIZED, "invalid_token", "Invalid authentication token");
            return false;
        }
        return true;
    }

    private boolean matches(String expected, String presented) {
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            presented.getBytes(StandardCharsets.UTF_8)
        );
    }

    private void writeError(HttpServletResponse response, HttpStatus status, String error, String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), Map.of("error", error, "message", message));
    }
}
