package com.skillmd.federation.api;

import com.skillmd.federation.source.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps a failing upstream source to a gateway status: 504 when the request's
 * deadline ran out, 502 for everything else.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SourceException.class)
    public ResponseEntity<Map<String, Object>> sourceFailure(SourceException e) {
        HttpStatus status = e.getKind() == SourceException.Kind.DEADLINE_EXCEEDED
                ? HttpStatus.GATEWAY_TIMEOUT
                : HttpStatus.BAD_GATEWAY;
        log.warn("Source '{}' failed the request ({}): {}", e.getSource(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of(
                "source", e.getSource().id(),
                "kind",   e.getKind().name(),
                "error",  e.getMessage()));
    }
}
