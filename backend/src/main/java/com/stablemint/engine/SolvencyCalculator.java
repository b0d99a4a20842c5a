package com.stablemint.engine;

import com.stablemint.ledger.CollateralLedger;
import com.stablemint.ledger.DebtLedger;
import com.stablemint.oracle.PriceOracleAdapter;
import com.stablemint.util.FixedPointMath;

import java.math.BigInteger;

import static com.stablemint.engine.EngineConstants.LIQUIDATION_PRECISION;
import static com.stablemint.engine.EngineConstants.LIQUIDATION_THRESHOLD;
import static com.stablemint.engine.EngineConstants.MIN_HEALTH_FACTOR;
import static com.stablemint.engine.EngineConstants.PRECISION;

/**
 * Health factor of an actor from the two ledgers and current prices.
 *
 * <pre>
 *   hf = (collateralUsd * LIQUIDATION_THRESHOLD / LIQUIDATION_PRECISION) * PRECISION / debt
 * </pre>
 * Integer division truncates at each step. Zero debt yields {@link FixedPointMath#MAX_UINT256}.
 */
public class SolvencyCalculator {

    private final CollateralLedger collateral;
    private final DebtLedger debt;
    private final PriceOracleAdapter oracle;

    public SolvencyCalculator(CollateralLedger collateral, DebtLedger debt, PriceOracleAdapter oracle) {
        this.collateral = collateral;
        this.debt = debt;
        this.oracle = oracle;
    }

    /** Sum of usdValue over every registered asset; zero balances are priced too. */
    public BigInteger collateralValueUsd(String actor) {
        BigInteger total = BigInteger.ZERO;
        for (String asset : collateral.registeredAssets()) {
            BigInteger amount = collateral.balanceOf(actor, asset);
            total = FixedPointMath.add(total, oracle.usdValue(asset, amount));
        }
        return total;
    }

    public AccountSnapshot accountSnapshot(String actor) {
        return new AccountSnapshot(debt.debtOf(actor), collateralValueUsd(actor));
    }

    public BigInteger healthFactor(String actor) {
        AccountSnapshot s = accountSnapshot(actor);
        return calculateHealthFactor(s.getTotalDscMinted(), s.getCollateralValueInUsd());
    }

    public static BigInteger calculateHealthFactor(BigInteger totalDscMinted, BigInteger collateralValueInUsd) {
        if (totalDscMinted.signum() == 0) return FixedPointMath.MAX_UINT256;
        BigInteger adjusted = FixedPointMath.mulDiv(collateralValueInUsd, LIQUIDATION_THRESHOLD, LIQUIDATION_PRECISION);
        return FixedPointMath.mulDiv(adjusted, PRECISION, totalDscMinted);
    }

    public static boolean isHealthy(BigInteger healthFactor) {
        return healthFactor.compareTo(MIN_HEALTH_FACTOR) >= 0;
    }
}
