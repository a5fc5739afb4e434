package com.nosota.lingodesk.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.lingodesk.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Writes 401 and 403 responses raised by the security filter chain in the same
 * {@link ErrorResponse} shape the controllers use.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonSecurityErrorHandler implements AuthenticationEntryPoint, AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        String message = request.getRequestURI().startsWith("/api/v1/")
                ? "A valid API key is required"
                : "Not authenticated";
        write(response, HttpStatus.UNAUTHORIZED, "Unauthorized", message, request);
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        log.warn("Access denied: {} {}", request.getMethod(), request.getRequestURI());
        write(response, HttpStatus.FORBIDDEN, "Forbidden", "Insufficient permissions", request);
    }

    private void write(HttpServletResponse response, HttpStatus status, String error, String message,
                       HttpServletRequest request) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getOutputStream(),
                ErrorResponse.of(status.value(), error, message, request.getRequestURI()));
    }
}
