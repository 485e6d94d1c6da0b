package com.flagship.atm.api.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response, shared by the exception handler and the session filter.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    String error;
    String message;
    Map<String, String> details;
    @JsonProperty("correlation_id")
    String correlationId;
    Instant timestamp;
}
