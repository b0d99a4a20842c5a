package com.stablemint.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "app")
@Data
public class AppProps {
    private Engine engine = new Engine();
    private Oracle oracle = new Oracle();
    private Monitor monitor = new Monitor();
    private Dev dev = new Dev();
    private Map<String, Network> network;

    public Network require(String networkName) {
        Network n = (network != null) ? network.get(networkName) : null;
        if (n == null) throw new IllegalArgumentException("Unknown network: " + networkName);
        return n;
    }

    @Data
    public static class Engine {
        /** Owner of the stable token; holds deposited collateral. */
        private String custodyAddress;
        private String stableTokenAddress;
        /** Registered collateral tokens, parallel to priceFeeds. */
        private List<String> collateralTokens = new ArrayList<>();
        private List<String> priceFeeds = new ArrayList<>();
    }

    @Data
    public static class Oracle {
        /** "static" (settable, in process) or "chainlink" (on-chain aggregators). */
        private String source = "static";
        /** Network key from app.network used by the chainlink source. */
        private String network = "mainnet";
        /** Maximum round age; 0 disables the age check. */
        private Duration staleTimeout = Duration.ofHours(3);
        /** Initial 8-decimal answers for the static source, keyed by feed address. */
        private Map<String, Long> staticAnswers = new LinkedHashMap<>();
    }

    @Data
    public static class Monitor {
        private boolean enabled = true;
        private String cron = "0 0/5 * * * ?";
    }

    @Data
    public static class Dev {
        /** Exposes faucet and price override endpoints. */
        private boolean enabled = false;
    }

    @Data
    public static class Network {
        private List<String> rpcUrls;
    }
}
