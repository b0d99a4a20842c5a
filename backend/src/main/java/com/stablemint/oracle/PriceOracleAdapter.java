package com.stablemint.oracle;

import com.stablemint.exception.EngineException;
import com.stablemint.exception.ErrorCode;
import com.stablemint.exception.OracleException;
import com.stablemint.util.FixedPointMath;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.stablemint.engine.EngineConstants.ADDITIONAL_FEED_PRECISION;
import static com.stablemint.engine.EngineConstants.FEED_DECIMALS;
import static com.stablemint.engine.EngineConstants.PRECISION;

/**
 * Turns raw feed rounds into 18-decimal USD prices and converts between token amounts and USD.
 *
 * <p>Rejects rounds that are incomplete ({@code updatedAt == 0}), carried over from an earlier
 * round ({@code answeredInRound < roundId}) or older than the configured timeout.
 * A zero timeout disables the age check only.</p>
 */
@Slf4j
public class PriceOracleAdapter {

    private final Map<String, String> feedByAsset;
    private final PriceFeed feed;
    private final Duration staleTimeout;
    private final Clock clock;

    public PriceOracleAdapter(Map<String, String> feedByAsset, PriceFeed feed, Duration staleTimeout, Clock clock) {
        this.feedByAsset = Collections.unmodifiableMap(new LinkedHashMap<>(feedByAsset));
        this.feed = feed;
        this.staleTimeout = staleTimeout == null ? Duration.ZERO : staleTimeout;
        this.clock = clock;
    }

    public String priceFeedOf(String asset) {
        String f = feedByAsset.get(asset);
        if (f == null) {
            throw new EngineException(ErrorCode.UNREGISTERED_ASSET, "Asset is not registered: " + asset,
                    Map.of("asset", asset));
        }
        return f;
    }

    /**
     * Latest price of one whole unit of {@code asset} in USD, 18 decimals. Never negative.
     */
    public BigInteger normalizedPrice(String asset) {
        String feedAddress = priceFeedOf(asset);
        PriceReading r = feed.latestRoundData(feedAddress);
        checkFresh(feedAddress, r);
        if (r.getDecimals() != FEED_DECIMALS) {
            throw new OracleException("Feed " + feedAddress + " reports " + r.getDecimals()
                    + " decimals, expected " + FEED_DECIMALS);
        }
        if (r.getAnswer() == null || r.getAnswer().signum() < 0) {
            throw new OracleException("Feed " + feedAddress + " returned a negative price: " + r.getAnswer());
        }
        BigInteger price = FixedPointMath.mul(r.getAnswer(), ADDITIONAL_FEED_PRECISION);
        log.debug("[oracle] asset={} feed={} round={} price={}", asset, feedAddress, r.getRoundId(), price);
        return price;
    }

    /** price * amount / 1e18 */
    public BigInteger usdValue(String asset, BigInteger amount) {
        return FixedPointMath.mulDiv(normalizedPrice(asset), amount, PRECISION);
    }

    /** usd * 1e18 / price; a zero price fails instead of dividing. */
    public BigInteger amountForUsd(String asset, BigInteger usdAmountInWei) {
        BigInteger price = normalizedPrice(asset);
        if (price.signum() == 0) {
            throw new OracleException("Price of " + asset + " is zero, cannot convert USD to token amount");
        }
        return FixedPointMath.mulDiv(usdAmountInWei, PRECISION, price);
    }

    private void checkFresh(String feedAddress, PriceReading r) {
        if (r.getUpdatedAt() == 0) {
            throw new OracleException("Stale price: round " + r.getRoundId() + " of " + feedAddress + " is incomplete");
        }
        if (r.getAnsweredInRound() != null && r.getRoundId() != null
                && r.getAnsweredInRound().compareTo(r.getRoundId()) < 0) {
            throw new OracleException("Stale price: " + feedAddress + " answered in round "
                    + r.getAnsweredInRound() + " < " + r.getRoundId());
        }
        if (!staleTimeout.isZero()) {
            long age = clock.instant().getEpochSecond() - r.getUpdatedAt();
            if (age > staleTimeout.getSeconds()) {
                throw new OracleException("Stale price: " + feedAddress + " last updated " + age + "s ago");
            }
        }
    }
}
