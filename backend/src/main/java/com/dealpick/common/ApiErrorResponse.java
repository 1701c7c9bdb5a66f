package com.dealpick.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * Error body for every failed request. {@code fieldErrors} is only present for request bodies
 * that failed bean validation.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ApiErrorResponse(
    Instant timestamp,
    int status,
    String error,
    String message,
    String path,
    List<String> fieldErrors
) {
}
