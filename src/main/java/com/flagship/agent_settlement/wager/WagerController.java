package com.flagship.agent_settlement.wager;

import com.flagship.agent_settlement.wager.dto.LeaderboardResponse;
import com.flagship.agent_settlement.wager.dto.PlaceWagerRequest;
import com.flagship.agent_settlement.wager.dto.WagerResponse;
import com.flagship.agent_settlement.wager.dto.WagerStatsResponse;
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

import java.util.UUID;

@RestController
@RequestMapping("/api/wagers")
@RequiredArgsConstructor
@Slf4j
public class WagerController {

    private final WagerService wagerService;

    @PostMapping
    public ResponseEntity<?> place(@Valid @RequestBody PlaceWagerRequest request) {
        log.info("Received wager: requester={}, game={}, stake={}",
                request.getRequesterId(), request.getGame(), request.getStake());
        return OutcomeResponses.respond(wagerService.placeWager(request.toCommand()), WagerResponse::from,
                HttpStatus.CREATED);
    }

    @PostMapping("/{id}/settle")
    public ResponseEntity<?> settle(@PathVariable("id") UUID id) {
        return OutcomeResponses.respond(wagerService.settleWager(id), WagerResponse::from);
    }

    @GetMapping("/{id}")
    public ResponseEntity<WagerResponse> get(@PathVariable("id") UUID id) {
        return wagerService.get(id)
                .map(wager -> ResponseEntity.ok(WagerResponse.from(wager)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/requesters/{requesterId}/stats")
    public WagerStatsResponse stats(@PathVariable("requesterId") String requesterId) {
        return WagerStatsResponse.from(wagerService.stats(requesterId));
    }

    @GetMapping("/leaderboard")
    public LeaderboardResponse leaderboard(
            @RequestParam(name = "type", required = false) String type,
            @RequestParam(name = "limit", defaultValue = "10") int limit) {
        LeaderboardType leaderboardType = LeaderboardType.parse(type);
        return LeaderboardResponse.from(leaderboardType, wagerService.leaderboard(leaderboardType, limit));
    }
}
