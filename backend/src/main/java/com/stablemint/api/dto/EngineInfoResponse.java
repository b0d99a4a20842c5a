package com.stablemint.api.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigInteger;
import java.util.Map;

/**
 * Static configuration of the engine: registered collateral with feeds, the stable token and all constants.
 */
@Data
@Builder
public class EngineInfoResponse {
    private String stableToken;
    /** Collateral token -> price feed, in registration order. */
    private Map<String, String> collateralPriceFeeds;
    private BigInteger precision;
    private BigInteger additionalFeedPrecision;
    private BigInteger liquidationThreshold;
    private BigInteger liquidationPrecision;
    private BigInteger liquidationBonus;
    private BigInteger minHealthFactor;
}
