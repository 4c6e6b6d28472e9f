package com.foliotrack.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * 400 response for analytics queries. parameter names the offending query parameter when one is known.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorBody(String error, String message, String parameter, Instant timestamp) {

    public static ErrorBody of(String error, String message, String parameter) {
        return new ErrorBody(error, message, parameter, Instant.now());
    }
}
