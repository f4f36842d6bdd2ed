package com.projecthub.xp.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class XpExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(XpExceptionHandler.class);

    @ExceptionHandler(XpEventRejectedException.class)
    public ResponseEntity<XpErrorResponse> handleRejected(XpEventRejectedException ex) {
        log.warn("Rejected XP request ({}): {}", ex.getCode(), ex.getMessage());
        return ResponseEntity
                .status(ex.getStatus())
                .body(new XpErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(XpStorageUnavailableException.class)
    public ResponseEntity<XpErrorResponse> handleStorageUnavailable(XpStorageUnavailableException ex) {
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new XpErrorResponse(XpStorageUnavailableException.CODE, ex.getMessage()));
    }

    public record XpErrorResponse(
            String code,
            String message
    ) {
    }
}
