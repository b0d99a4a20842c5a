package com.stablemint.oracle;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * One round of an aggregator feed, as returned by latestRoundData() plus decimals().
 * {@code answer} is signed; {@code updatedAt} is in epoch seconds.
 */
@Value
@Builder(toBuilder = true)
public class PriceReading {
    BigInteger roundId;
    BigInteger answer;
    long startedAt;
    long updatedAt;
    BigInteger answeredInRound;
    int decimals;
}
