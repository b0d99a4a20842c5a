package com.stablemint.oracle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.stablemint.exception.BaseException;
import com.stablemint.exception.ErrorCode;
import com.stablemint.exception.OracleException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for PriceOracleAdapter: price normalization, USD conversions and round validation.
 */
class PriceOracleAdapterTest {

    private static final String WETH = "0x1000000000000000000000000000000000000001";
    private static final String ETH_FEED = "0x2000000000000000000000000000000000000001";
    private static final String UNKNOWN = "0x9000000000000000000000000000000000000009";
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final BigInteger E18 = BigInteger.TEN.pow(18);

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private StaticPriceFeed feed;
    private PriceOracleAdapter oracle;

    @BeforeEach
    void setUp() {
        feed = new StaticPriceFeed(8, clock);
        feed.updateAnswer(ETH_FEED, BigInteger.valueOf(2000_00000000L));
        oracle = new PriceOracleAdapter(Map.of(WETH, ETH_FEED), feed, Duration.ofHours(3), clock);
    }

    private PriceReading.PriceReadingBuilder current() {
        return feed.latestRoundData(ETH_FEED).toBuilder();
    }

    private static void assertOracleFailure(Runnable r) {
        assertThatThrownBy(r::run).isInstanceOf(OracleException.class)
                .satisfies(t -> assertThat(((BaseException) t).getErrorCode()).isEqualTo(ErrorCode.ORACLE_FAILURE));
    }

    // ==============================
    // CONVERSIONS
    // ==============================

    @Nested
    @DisplayName("Conversions")
    class Conversions {

        @Test
        @DisplayName("Feed answer is scaled to 18 decimals")
        void normalizedPrice() {
            assertThat(oracle.normalizedPrice(WETH)).isEqualTo(BigInteger.valueOf(2000).multiply(E18));
        }

        @Test
        @DisplayName("15 ETH at 2000 USD is worth 30000 USD")
        void usdValue() {
            assertThat(oracle.usdValue(WETH, BigInteger.valueOf(15).multiply(E18)))
                    .isEqualTo(BigInteger.valueOf(30000).multiply(E18));
        }

        @Test
        @DisplayName("100 USD buys 0.05 ETH at 2000 USD")
        void amountForUsd() {
            assertThat(oracle.amountForUsd(WETH, BigInteger.valueOf(100).multiply(E18)))
                    .isEqualTo(new BigInteger("50000000000000000"));
        }

        @Test
        @DisplayName("10 ETH at 3000 USD is worth 30000 USD and 300 USD buys 0.1 ETH")
        void at3000() {
            feed.updateAnswer(ETH_FEED, BigInteger.valueOf(3000_00000000L));

            assertThat(oracle.usdValue(WETH, BigInteger.valueOf(10).multiply(E18)))
                    .isEqualTo(BigInteger.valueOf(30000).multiply(E18));
            assertThat(oracle.amountForUsd(WETH, BigInteger.valueOf(300).multiply(E18)))
                    .isEqualTo(new BigInteger("100000000000000000"));
        }

        @ParameterizedTest(name = "{0} USD, amount {1}")
        @CsvSource({
                "1, 1",
                "1, 1000000000000000001",
                "7, 333333333333333333",
                "1650, 9090909090909090909",
                "3000, 1",
                "3000, 10000000000000000000",
                "12345, 77",
                "99999, 123456789012345678901",
                "99999, 999999999999999999"
        })
        @DisplayName("USD value converted back to tokens loses at most one wei")
        void roundTrip(long usd, String rawAmount) {
            feed.updateAnswer(ETH_FEED, BigInteger.valueOf(usd).multiply(BigInteger.TEN.pow(8)));
            BigInteger amount = new BigInteger(rawAmount);

            BigInteger back = oracle.amountForUsd(WETH, oracle.usdValue(WETH, amount));

            assertThat(back).isLessThanOrEqualTo(amount).isGreaterThanOrEqualTo(amount.subtract(BigInteger.ONE));
        }

        @Test
        @DisplayName("Sub-wei results truncate to zero")
        void truncation() {
            assertThat(oracle.usdValue(WETH, BigInteger.ZERO)).isZero();
            assertThat(oracle.amountForUsd(WETH, BigInteger.ONE)).isZero();
        }

        @Test
        @DisplayName("Unregistered asset has no feed")
        void unregistered() {
            assertThatThrownBy(() -> oracle.usdValue(UNKNOWN, BigInteger.ONE))
                    .satisfies(t -> assertThat(((BaseException) t).getErrorCode()).isEqualTo(ErrorCode.UNREGISTERED_ASSET));
        }
    }

    // ==============================
    // PRICE SIGN
    // ==============================

    @Nested
    @DisplayName("Price sign")
    class PriceSign {

        @Test
        @DisplayName("Zero price values collateral at zero but cannot convert USD back")
        void zeroPrice() {
            feed.updateAnswer(ETH_FEED, BigInteger.ZERO);

            assertThat(oracle.usdValue(WETH, E18)).isZero();
            assertOracleFailure(() -> oracle.amountForUsd(WETH, E18));
        }

        @Test
        @DisplayName("Negative price is rejected")
        void negativePrice() {
            feed.updateAnswer(ETH_FEED, BigInteger.valueOf(-1));

            assertOracleFailure(() -> oracle.usdValue(WETH, E18));
        }
    }

    // ==============================
    // ROUND VALIDATION
    // ==============================

    @Nested
    @DisplayName("Round validation")
    class RoundValidation {

        @Test
        @DisplayName("Round exactly at the timeout is still fresh")
        void atTimeout() {
            feed.setRound(ETH_FEED, current().updatedAt(NOW.minus(Duration.ofHours(3)).getEpochSecond()).build());

            assertThat(oracle.normalizedPrice(WETH)).isPositive();
        }

        @Test
        @DisplayName("Round older than the timeout is stale")
        void pastTimeout() {
            feed.setRound(ETH_FEED, current().updatedAt(NOW.minus(Duration.ofHours(3)).getEpochSecond() - 1).build());

            assertOracleFailure(() -> oracle.normalizedPrice(WETH));
        }

        @Test
        @DisplayName("Incomplete round is stale")
        void incompleteRound() {
            feed.setRound(ETH_FEED, current().updatedAt(0).build());

            assertOracleFailure(() -> oracle.normalizedPrice(WETH));
        }

        @Test
        @DisplayName("Answer carried over from an earlier round is stale")
        void carriedOver() {
            feed.setRound(ETH_FEED, current().roundId(BigInteger.TEN).answeredInRound(BigInteger.valueOf(9)).build());

            assertOracleFailure(() -> oracle.normalizedPrice(WETH));
        }

        @Test
        @DisplayName("Zero timeout disables only the age check")
        void ageCheckDisabled() {
            PriceOracleAdapter lenient = new PriceOracleAdapter(Map.of(WETH, ETH_FEED), feed, Duration.ZERO, clock);
            feed.setRound(ETH_FEED, current().updatedAt(1).build());

            assertThat(lenient.normalizedPrice(WETH)).isEqualTo(BigInteger.valueOf(2000).multiply(E18));

            feed.setRound(ETH_FEED, current().updatedAt(0).build());
            assertOracleFailure(() -> lenient.normalizedPrice(WETH));
        }

        @Test
        @DisplayName("Feeds with other than 8 decimals are rejected")
        void unsupportedDecimals() {
            feed.setRound(ETH_FEED, current().decimals(18).build());

            assertOracleFailure(() -> oracle.normalizedPrice(WETH));
        }

        @Test
        @DisplayName("Feed without any round fails")
        void noRound() {
            StaticPriceFeed empty = new StaticPriceFeed(8, clock);
            PriceOracleAdapter o = new PriceOracleAdapter(Map.of(WETH, ETH_FEED), empty, Duration.ofHours(3), clock);

            assertOracleFailure(() -> o.normalizedPrice(WETH));
        }
    }

    @Test
    @DisplayName("Each update starts a new round")
    void roundsAdvance() {
        feed.updateAnswer(ETH_FEED, BigInteger.valueOf(2100_00000000L));

        PriceReading r = feed.latestRoundData(ETH_FEED);
        assertThat(r.getRoundId()).isEqualTo(BigInteger.TWO);
        assertThat(r.getAnsweredInRound()).isEqualTo(BigInteger.TWO);
        assertThat(r.getUpdatedAt()).isEqualTo(NOW.getEpochSecond());
    }
}
