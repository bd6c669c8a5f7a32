package com.flagship.agent_settlement.exchange;

import com.flagship.agent_settlement.common.Outcome;
import com.flagship.agent_settlement.common.OutcomeCode;
import com.flagship.agent_settlement.exchange.dto.CancelExchangeRequest;
import com.flagship.agent_settlement.exchange.dto.ExchangeResponse;
import com.flagship.agent_settlement.exchange.dto.ProposeExchangeRequest;
import com.flagship.agent_settlement.exchange.dto.ReopenExchangeRequest;
import com.flagship.agent_settlement.policy.ComplianceResult;
import com.flagship.agent_settlement.settlement.dto.SettlementReceiptResponse;
import com.flagship.agent_settlement.web.OutcomeResponses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST surface for operators and the chat front end driving exchanges.
 */
@RestController
@RequestMapping("/api/exchanges")
@RequiredArgsConstructor
@Slf4j
public class ExchangeController {

    private final ExchangeService exchangeService;

    @PostMapping
    public ResponseEntity<?> propose(@Valid @RequestBody ProposeExchangeRequest request) {
        log.info("Received exchange proposal: counterparty={}, channel={}",
                request.getCounterpartyId(), request.getInitiatorChannel());

        Outcome<ProposalResult> outcome = exchangeService.propose(request.toCommand());
        if (outcome.getCode() == OutcomeCode.POLICY_VIOLATION) {
            return OutcomeResponses.error(outcome.getCode(), outcome.getMessage(),
                    complianceDetails(outcome.getValue().getCompliance()));
        }
        return OutcomeResponses.respond(outcome, result -> ExchangeResponse.from(result.getRecord()),
                HttpStatus.CREATED);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ExchangeResponse> get(@PathVariable("id") UUID id) {
        return exchangeService.get(id)
                .map(record -> ResponseEntity.ok(ExchangeResponse.from(record)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public List<ExchangeResponse> list(@RequestParam(value = "status", required = false) ExchangeStatus status) {
        return exchangeService.list(status).stream().map(ExchangeResponse::from).toList();
    }

    @PostMapping("/{id}/accept")
    public ResponseEntity<?> accept(@PathVariable("id") UUID id) {
        return OutcomeResponses.respond(exchangeService.accept(id), ExchangeResponse::from);
    }

    @PostMapping("/{id}/decline")
    public ResponseEntity<?> decline(@PathVariable("id") UUID id) {
        return OutcomeResponses.respond(exchangeService.decline(id), ExchangeResponse::from);
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable("id") UUID id,
                                    @Valid @RequestBody(required = false) CancelExchangeRequest request) {
        String reason = request != null ? request.getReason() : null;
        return OutcomeResponses.respond(exchangeService.cancel(id, reason), ExchangeResponse::from);
    }

    @PostMapping("/{id}/verify")
    public ResponseEntity<?> verify(@PathVariable("id") UUID id) {
        return OutcomeResponses.respond(exchangeService.verify(id), ExchangeResponse::from);
    }

    @PostMapping("/{id}/execute")
    public ResponseEntity<?> execute(@PathVariable("id") UUID id) {
        return OutcomeResponses.respond(exchangeService.execute(id), SettlementReceiptResponse::from);
    }

    @PostMapping("/{id}/reopen")
    public ResponseEntity<?> reopen(@PathVariable("id") UUID id,
                                    @Valid @RequestBody ReopenExchangeRequest request) {
        log.warn("Operator reopening failed exchange {}", id);
        return OutcomeResponses.respond(exchangeService.reopenFailed(id, request.getNote()), ExchangeResponse::from);
    }

    private static Map<String, Object> complianceDetails(ComplianceResult compliance) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("rule", compliance.getRule());
        details.put("reason", compliance.getReason());
        details.put("reference_value", compliance.getReferenceValueUsed());
        details.put("percentage_of_reference", compliance.getPercentageOfReference());
        details.put("profit", compliance.getProfit());
        return details;
    }
}
