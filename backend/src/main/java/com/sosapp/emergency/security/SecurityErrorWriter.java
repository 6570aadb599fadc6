package com.sosapp.emergency.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sosapp.emergency.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;

/**
 * Writes filter-chain rejections in the same {@link ApiError} shape the controllers use.
 */
@Component
@RequiredArgsConstructor
class SecurityErrorWriter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    void write(HttpServletRequest request, HttpServletResponse response, HttpStatus status, String message)
            throws IOException {
        ApiError error = ApiError.builder()
                .timestamp(Instant.now(clock))
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.name())
                .errorCode(status.name())
                .message(message)
                .requestId(MDC.get("requestId"))
                .correlationId(MDC.get("correlationId"))
                .build();
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
