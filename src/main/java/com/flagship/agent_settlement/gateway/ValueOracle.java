package com.flagship.agent_settlement.gateway;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Best-effort price discovery for unique items.
 */
public interface ValueOracle {

    Optional<BigDecimal> estimateValue(String itemRef);
}
