package com.stablemint.oracle;

/**
 * Source of raw aggregator rounds, keyed by the feed address.
 */
public interface PriceFeed {

    /**
     * @param feedAddress normalized 0x address of the aggregator
     * @throws com.stablemint.exception.OracleException if the feed cannot be read
     */
    PriceReading latestRoundData(String feedAddress);
}
