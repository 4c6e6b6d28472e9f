package com.foliotrack.api.controller;

import com.foliotrack.api.dto.ErrorBody;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Query binding and validation failures become 400 with an {@link ErrorBody}.
 * Unparseable values (dates, groupBy) map to INVALID_PARAMETER; constraint violations use their message as code.
 */
@RestControllerAdvice
@Slf4j
public class ValidationExceptionHandler {

    private static final String INVALID_PARAMETER = "INVALID_PARAMETER";
    private static final String INVALID_DATE_RANGE = "INVALID_DATE_RANGE";

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        FieldError fieldError = ex.getFieldError();
        if (fieldError != null && fieldError.isBindingFailure()) {
            log.debug("Rejected {}={}", fieldError.getField(), fieldError.getRejectedValue());
            return ResponseEntity.badRequest().body(ErrorBody.of(INVALID_PARAMETER,
                    "Invalid value '" + fieldError.getRejectedValue() + "'", fieldError.getField()));
        }
        ObjectError globalError = ex.getGlobalError();
        if (globalError != null && INVALID_DATE_RANGE.equals(globalError.getDefaultMessage())) {
            return ResponseEntity.badRequest().body(ErrorBody.of(INVALID_DATE_RANGE,
                    "from must not be after to", "from"));
        }
        if (fieldError != null) {
            return ResponseEntity.badRequest().body(ErrorBody.of(INVALID_PARAMETER,
                    fieldError.getDefaultMessage(), fieldError.getField()));
        }
        return ResponseEntity.badRequest().body(ErrorBody.of(INVALID_PARAMETER, "Validation failed", null));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(INVALID_PARAMETER,
                ex.getReason() != null ? ex.getReason() : "Invalid request parameter", null));
    }
}
