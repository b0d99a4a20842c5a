package com.stablemint.config;

import com.stablemint.engine.DscEngine;
import com.stablemint.engine.EngineConstants;
import com.stablemint.oracle.PriceFeed;
import com.stablemint.oracle.StaticPriceFeed;
import com.stablemint.token.InMemoryStableToken;
import com.stablemint.token.InMemoryTokenBank;
import com.stablemint.web3.ChainlinkPriceFeed;
import com.stablemint.web3.Web3ClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Wires the engine from {@link AppProps}: token collaborators, the configured price source and the engine itself.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InMemoryTokenBank collateralTokenBank() {
        return new InMemoryTokenBank();
    }

    @Bean
    public InMemoryStableToken stableToken(AppProps props) {
        AppProps.Engine e = props.getEngine();
        return new InMemoryStableToken(e.getStableTokenAddress(), e.getCustodyAddress());
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.oracle", name = "source", havingValue = "static", matchIfMissing = true)
    public StaticPriceFeed staticPriceFeed(AppProps props, Clock clock) {
        StaticPriceFeed feed = new StaticPriceFeed(EngineConstants.FEED_DECIMALS, clock);
        props.getOracle().getStaticAnswers()
                .forEach((address, answer) -> feed.updateAnswer(address, BigInteger.valueOf(answer)));
        return feed;
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.oracle", name = "source", havingValue = "chainlink")
    public Web3ClientFactory web3ClientFactory(AppProps props) {
        return new Web3ClientFactory(props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.oracle", name = "source", havingValue = "chainlink")
    public ChainlinkPriceFeed chainlinkPriceFeed(Web3ClientFactory factory, AppProps props) {
        log.info("Reading prices from chainlink aggregators on {}", props.getOracle().getNetwork());
        return new ChainlinkPriceFeed(factory, props.getOracle().getNetwork());
    }

    @Bean
    public DscEngine dscEngine(AppProps props,
                               InMemoryStableToken stableToken,
                               InMemoryTokenBank collateralTokenBank,
                               PriceFeed priceFeed,
                               Clock clock,
                               ApplicationEventPublisher publisher) {
        AppProps.Engine e = props.getEngine();
        return new DscEngine(
                e.getCollateralTokens(),
                e.getPriceFeeds(),
                stableToken,
                collateralTokenBank,
                priceFeed,
                props.getOracle().getStaleTimeout(),
                clock,
                publisher,
                e.getCustodyAddress());
    }
}
