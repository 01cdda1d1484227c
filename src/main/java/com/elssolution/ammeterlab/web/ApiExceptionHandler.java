package com.elssolution.ammeterlab.web;

import com.elssolution.ammeterlab.exception.AmmeterLabException;
import com.elssolution.ammeterlab.exception.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/** Maps lab exceptions to JSON error bodies: CONFIG/INCOMPATIBLE 400, NOT_FOUND 404, ARCHIVE 503, others 502. */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(String code, String message, String path, Instant timestamp) {
    }

    @ExceptionHandler(AmmeterLabException.class)
    public ResponseEntity<ErrorResponse> onLabException(AmmeterLabException e, HttpServletRequest req) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.warn("api_error kind={} path={}: {}", e.getKind(), req.getRequestURI(), e.getMessage());
        } else {
            log.debug("api_rejected kind={} path={}: {}", e.getKind(), req.getRequestURI(), e.getMessage());
        }
        return body(status, e.getKind().name(), e.getMessage(), req);
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> onBadRequest(Exception e, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, ErrorKind.CONFIG.name(), e.getMessage(), req);
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case CONFIG, INCOMPATIBLE -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ARCHIVE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_GATEWAY;
        };
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String code, String message, HttpServletRequest req) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(code, message, req == null ? null : req.getRequestURI(), Instant.now()));
    }
}
