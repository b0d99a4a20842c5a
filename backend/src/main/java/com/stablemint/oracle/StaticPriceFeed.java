package com.stablemint.oracle;

import com.stablemint.exception.OracleException;
import com.stablemint.util.AddressUtil;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Settable in-process feed. Each {@link #updateAnswer} starts a new round stamped with the clock,
 * the way a mock aggregator does on a local chain.
 */
@Slf4j
public class StaticPriceFeed implements PriceFeed {

    private final Map<String, PriceReading> rounds = new ConcurrentHashMap<>();
    private final int decimals;
    private final Clock clock;

    public StaticPriceFeed(int decimals, Clock clock) {
        this.decimals = decimals;
        this.clock = clock;
    }

    public void updateAnswer(String feedAddress, BigInteger answer) {
        String feed = AddressUtil.normalize(feedAddress);
        long now = clock.instant().getEpochSecond();
        rounds.compute(feed, (k, prev) -> {
            BigInteger round = prev == null ? BigInteger.ONE : prev.getRoundId().add(BigInteger.ONE);
            return PriceReading.builder()
                    .roundId(round)
                    .answer(answer)
                    .startedAt(now)
                    .updatedAt(now)
                    .answeredInRound(round)
                    .decimals(decimals)
                    .build();
        });
        log.info("[static-feed] {} answer={} decimals={}", feed, answer, decimals);
    }

    /** Replace the whole round, e.g. to simulate a stale or incomplete one. */
    public void setRound(String feedAddress, PriceReading reading) {
        rounds.put(AddressUtil.normalize(feedAddress), reading);
    }

    @Override
    public PriceReading latestRoundData(String feedAddress) {
        PriceReading r = rounds.get(AddressUtil.normalize(feedAddress));
        if (r == null) throw new OracleException("No answer set for feed " + feedAddress);
        return r;
    }
}
