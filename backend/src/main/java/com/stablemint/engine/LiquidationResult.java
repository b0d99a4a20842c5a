package com.stablemint.engine;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Outcome of a committed liquidation.
 */
@Value
@Builder
public class LiquidationResult {
    String liquidator;
    String target;
    String asset;
    BigInteger debtCovered;
    /** Collateral equivalent of the covered debt, before the bonus. */
    BigInteger tokenAmountFromDebtCovered;
    BigInteger bonusCollateral;
    BigInteger totalCollateralRedeemed;
    BigInteger startingHealthFactor;
    BigInteger endingHealthFactor;
}
