package com.flagship.agent_settlement.wager;

import java.math.BigDecimal;

/**
 * @param memoTag memo the requester will put on the stake payment
 */
public record PlaceWagerCommand(
        String requesterId,
        String memoTag,
        String channel,
        WagerGame game,
        BigDecimal stake
) {
}
