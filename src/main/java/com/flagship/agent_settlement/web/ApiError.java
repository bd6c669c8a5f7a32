package com.flagship.agent_settlement.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Standard API error response.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    @JsonProperty("error")
    String error;

    /** Outcome code for domain failures, absent for request errors. */
    @JsonProperty("code")
    String code;

    @JsonProperty("message")
    String message;

    @JsonProperty("details")
    Map<String, Object> details;

    @JsonProperty("timestamp")
    Instant timestamp;
}
