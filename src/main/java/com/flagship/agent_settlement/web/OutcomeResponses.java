package com.flagship.agent_settlement.web;

import com.flagship.agent_settlement.common.Outcome;
import com.flagship.agent_settlement.common.OutcomeCode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns {@link Outcome} values into HTTP responses.
 */
public final class OutcomeResponses {

    private OutcomeResponses() {
    }

    public static HttpStatus statusFor(OutcomeCode code) {
        return switch (code) {
            case OK -> HttpStatus.OK;
            case NOT_YET_VERIFIED -> HttpStatus.ACCEPTED;
            case POLICY_VIOLATION, REJECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CONFLICT, ALREADY_CLAIMED, ALREADY_CONSUMED, AMBIGUOUS_MULTIPLE_MATCHES, INVALID_STATE ->
                    HttpStatus.CONFLICT;
            case EXPIRED -> HttpStatus.GONE;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case EXTERNAL_TRANSFER_FAILURE -> HttpStatus.BAD_GATEWAY;
        };
    }

    public static <T, R> ResponseEntity<?> respond(Outcome<T> outcome, Function<T, R> mapper) {
        return respond(outcome, mapper, HttpStatus.OK);
    }

    public static <T, R> ResponseEntity<?> respond(Outcome<T> outcome, Function<T, R> mapper, HttpStatus okStatus) {
        if (outcome.isOk()) {
            return ResponseEntity.status(okStatus).body(mapper.apply(outcome.getValue()));
        }
        return error(outcome.getCode(), outcome.getMessage(), null);
    }

    public static ResponseEntity<ApiError> error(OutcomeCode code, String message, Map<String, Object> details) {
        HttpStatus status = statusFor(code);
        return ResponseEntity.status(status).body(ApiError.builder()
                .error(status.getReasonPhrase())
                .code(code.name())
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build());
    }
}
