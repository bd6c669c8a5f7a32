package com.flagship.agent_settlement.jackpot;

import com.flagship.agent_settlement.jackpot.dto.AwardJackpotRequest;
import com.flagship.agent_settlement.jackpot.dto.JackpotPayoutResponse;
import com.flagship.agent_settlement.jackpot.dto.JackpotStateResponse;
import com.flagship.agent_settlement.web.OutcomeResponses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/jackpot")
@RequiredArgsConstructor
@Slf4j
public class JackpotController {

    private final JackpotService jackpotService;

    @GetMapping
    public JackpotStateResponse state() {
        return JackpotStateResponse.from(jackpotService.state(), jackpotService.isEligible());
    }

    @PostMapping("/award")
    public ResponseEntity<?> award(@Valid @RequestBody AwardJackpotRequest request) {
        log.info("Jackpot award requested for {}", request.getWinnerId());
        return OutcomeResponses.respond(
                jackpotService.award(request.getWinnerId(), request.getWinnerAddress(), request.getChannel()),
                JackpotPayoutResponse::from);
    }
}
