package io.github.drompincen.startpage.gateway.controller;

import io.github.drompincen.startpage.runtime.InvalidArgumentException;
import io.github.drompincen.startpage.runtime.auth.IncorrectPasswordException;
import io.github.drompincen.startpage.runtime.auth.UnauthorizedException;
import io.github.drompincen.startpage.runtime.catalog.LinkNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/** Translates service exceptions into status codes with a {@code {"detail": ...}} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<Map<String, String>> unauthorized(UnauthorizedException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(detail(e.getMessage()));
    }

    @ExceptionHandler(LinkNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(LinkNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(detail("Link not found"));
    }

    @ExceptionHandler({InvalidArgumentException.class, IncorrectPasswordException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(detail(e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(detail("Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> typeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest().body(detail("Invalid value for '" + e.getName() + "'"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, String>> missingParameter(MissingServletRequestParameterException e) {
        return ResponseEntity.badRequest().body(detail("Missing parameter '" + e.getParameterName() + "'"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> unexpected(Exception e) {
        if (e instanceof ErrorResponse) {
            // framework errors (unknown route, wrong method) keep their own status
            ErrorResponse framework = (ErrorResponse) e;
            return ResponseEntity.status(framework.getStatusCode()).body(detail(framework.getBody().getDetail()));
        }
        log.error("Unhandled error while serving request", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(detail("Internal server error"));
    }

    private static Map<String, String> detail(String message) {
        return Map.of("detail", message == null ? "" : message);
    }
}
