package com.flagship.agent_settlement.wager;

import java.util.UUID;

/**
 * Source of the random draw for a wager, for example the chat platform's
 * animated dice. Called at most once per wager.
 */
public interface OutcomeSource {

    /**
     * @return an outcome within the game's range
     */
    int draw(WagerGame game, UUID wagerId);
}
