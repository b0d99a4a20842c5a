package com.stablemint.engine;

import java.math.BigInteger;

/**
 * Fixed-point parameters of the engine. Values are part of the external contract and must not drift.
 */
public final class EngineConstants {
    private EngineConstants() {}

    /** 1e18, the fixed-point "one". */
    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);
    /** Scales 8-decimal feed answers up to 18 decimals. */
    public static final BigInteger ADDITIONAL_FEED_PRECISION = BigInteger.TEN.pow(10);
    /** Only feeds reporting this many decimals are accepted. */
    public static final int FEED_DECIMALS = 8;
    /** Collateral counts at 50% of its value for solvency. */
    public static final BigInteger LIQUIDATION_THRESHOLD = BigInteger.valueOf(50);
    public static final BigInteger LIQUIDATION_PRECISION = BigInteger.valueOf(100);
    /** 10% bonus paid to liquidators. */
    public static final BigInteger LIQUIDATION_BONUS = BigInteger.valueOf(10);
    public static final BigInteger MIN_HEALTH_FACTOR = PRECISION;
}
