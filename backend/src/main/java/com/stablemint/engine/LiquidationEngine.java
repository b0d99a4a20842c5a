package com.stablemint.engine;

import com.stablemint.exception.EngineException;
import com.stablemint.exception.ErrorCode;
import com.stablemint.ledger.CollateralLedger;
import com.stablemint.oracle.PriceOracleAdapter;
import com.stablemint.util.FixedPointMath;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;

import static com.stablemint.engine.EngineConstants.LIQUIDATION_BONUS;
import static com.stablemint.engine.EngineConstants.LIQUIDATION_PRECISION;

/**
 * Third-party repair of an unhealthy position.
 *
 * <p>The liquidator repays {@code debtToCover} of the target's debt and receives the collateral equivalent
 * plus {@link EngineConstants#LIQUIDATION_BONUS}% of it. The target's health factor must strictly rise and
 * the liquidator must itself remain healthy, otherwise nothing happens.</p>
 *
 * <p>If the target no longer holds enough of {@code asset} to pay the bonus the liquidation is refused as a
 * whole; there is no partial payout.</p>
 */
@Slf4j
public class LiquidationEngine {

    private final PositionEngine positions;
    private final SolvencyCalculator solvency;
    private final PriceOracleAdapter oracle;
    private final CollateralLedger collateral;
    private final EngineGuard guard;

    public LiquidationEngine(PositionEngine positions,
                             SolvencyCalculator solvency,
                             PriceOracleAdapter oracle,
                             CollateralLedger collateral,
                             EngineGuard guard) {
        this.positions = positions;
        this.solvency = solvency;
        this.oracle = oracle;
        this.collateral = collateral;
        this.guard = guard;
    }

    public LiquidationResult liquidate(String liquidator, String asset, String target, BigInteger debtToCover) {
        LiquidationResult result = guard.execute("liquidate", liquidator,
                ctx -> liquidate(ctx, liquidator, asset, target, debtToCover));
        log.info("[liquidation] {} covered {} of {}'s debt, received {} of {} (hf {} -> {})",
                liquidator, debtToCover, target, result.getTotalCollateralRedeemed(), asset,
                result.getStartingHealthFactor(), result.getEndingHealthFactor());
        return result;
    }

    private LiquidationResult liquidate(OperationContext ctx, String liquidator, String asset, String target,
                                        BigInteger debtToCover) {
        if (debtToCover == null || debtToCover.signum() <= 0) {
            throw new EngineException(ErrorCode.INVALID_INPUT, "Debt to cover must be more than zero",
                    Map.of("debtToCover", String.valueOf(debtToCover)));
        }
        collateral.requireRegistered(asset);

        BigInteger startingHf = solvency.healthFactor(target);
        if (SolvencyCalculator.isHealthy(startingHf)) {
            throw new EngineException(ErrorCode.HEALTH_FACTOR_OK,
                    "Target " + target + " is healthy, health factor " + startingHf,
                    Map.of("target", target, "healthFactor", startingHf.toString()));
        }

        BigInteger tokenAmount = oracle.amountForUsd(asset, debtToCover);
        BigInteger bonus = FixedPointMath.mulDiv(tokenAmount, LIQUIDATION_BONUS, LIQUIDATION_PRECISION);
        BigInteger total = FixedPointMath.add(tokenAmount, bonus);

        BigInteger onHand = collateral.balanceOf(target, asset);
        if (total.compareTo(onHand) > 0) {
            throw new EngineException(ErrorCode.EXTERNAL_TRANSFER_UNDERFUNDED,
                    "Liquidation payout " + total + " exceeds target's " + onHand + " of " + asset,
                    Map.of("target", target, "asset", asset, "payout", total.toString(), "available", onHand.toString()));
        }

        positions.redeem(ctx, asset, total, target, liquidator);
        positions.burn(ctx, debtToCover, target, liquidator);

        BigInteger endingHf = solvency.healthFactor(target);
        if (endingHf.compareTo(startingHf) <= 0) {
            throw new EngineException(ErrorCode.HEALTH_FACTOR_NOT_IMPROVED,
                    "Liquidation would move health factor of " + target + " from " + startingHf + " to " + endingHf,
                    Map.of("target", target, "startingHealthFactor", startingHf.toString(),
                            "endingHealthFactor", endingHf.toString()));
        }
        positions.requireHealthy(liquidator);

        return LiquidationResult.builder()
                .liquidator(liquidator)
                .target(target)
                .asset(asset)
                .debtCovered(debtToCover)
                .tokenAmountFromDebtCovered(tokenAmount)
                .bonusCollateral(bonus)
                .totalCollateralRedeemed(total)
                .startingHealthFactor(startingHf)
                .endingHealthFactor(endingHf)
                .build();
    }
}
