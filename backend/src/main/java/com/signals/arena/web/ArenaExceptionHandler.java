package com.signals.arena.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ArenaExceptionHandler {

    @ExceptionHandler(ArenaNotFoundException.class)
    public ResponseEntity<ArenaErrorResponse> handleNotFound(ArenaNotFoundException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new ArenaErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(InvalidAddressException.class)
    public ResponseEntity<ArenaErrorResponse> handleInvalidAddress(InvalidAddressException ex) {
        return ResponseEntity.badRequest()
                .body(new ArenaErrorResponse("invalid_address", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ArenaErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ArenaErrorResponse("invalid_parameter", "Invalid value for '" + ex.getName() + "'"));
    }

    public record ArenaErrorResponse(
            String code,
            String message
    ) {
    }
}
