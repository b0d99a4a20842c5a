package com.stablemint.web3;

import com.stablemint.config.AppProps;
import com.stablemint.web3.exception.RetryableRpcException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Builds and manages multiple Web3j clients per network and fails over
 * between RPC endpoints on rate-limit or IO errors.
 */
@Slf4j
public class Web3ClientFactory {

    private final AppProps props;
    private final Function<String, Web3j> clientBuilder;

    /**
     * Endpoint state with simple penalty window (circuit half-open).
     */
    private static class Endpoint {
        final String url;
        final Web3j web3j;
        volatile Instant penaltyUntil = Instant.EPOCH;

        Endpoint(String url, Web3j web3j) {
            this.url = url;
            this.web3j = web3j;
        }

        boolean isAvailable() {
            return Instant.now().isAfter(penaltyUntil);
        }

        void penalize(Duration d) {
            penaltyUntil = Instant.now().plus(d);
        }
    }

    /** Network -> endpoints ring */
    private final Map<String, List<Endpoint>> endpointsByNet = new ConcurrentHashMap<>();
    /** Network -> round-robin index */
    private final Map<String, Integer> rrIndex = new ConcurrentHashMap<>();

    private Duration baseBackoff = Duration.ofMillis(400);
    private final Duration maxBackoff = Duration.ofSeconds(5);
    private final Duration penalty = Duration.ofSeconds(20);

    public Web3ClientFactory(AppProps props) {
        this(props, url -> Web3j.build(new HttpService(url)));
    }

    Web3ClientFactory(AppProps props, Function<String, Web3j> clientBuilder) {
        this.props = props;
        this.clientBuilder = clientBuilder;
    }

    void setBaseBackoff(Duration baseBackoff) {
        this.baseBackoff = baseBackoff;
    }

    /**
     * Execute a function against Web3j with RPC failover.
     *
     * @param network network key (e.g. "mainnet")
     * @param fn      function to execute; MUST throw RetryableRpcException for logical rate-limit responses
     * @param <T>     return type
     */
    public <T> T executeWithFailover(String network, Function<Web3j, T> fn) {
        List<Endpoint> ring = getOrInit(network);
        if (ring.isEmpty()) throw new IllegalStateException("No RPC URLs configured for network: " + network);

        final int total = ring.size();
        int start = rrIndex.compute(network, (k, v) -> v == null ? 0 : (v + 1) % total);
        int tried = 0;

        RuntimeException last = null;

        while (tried < total) {
            int idx = (start + tried) % total;
            Endpoint ep = ring.get(idx);

            if (!ep.isAvailable()) {
                tried++;
                continue;
            }

            try {
                T out = fn.apply(ep.web3j);
                rrIndex.put(network, idx);
                return out;
            } catch (RetryableRpcException ex) {
                last = ex;
                log.warn("[web3 failover] Retryable on {}: {}", ep.url, ex.getMessage());
                ep.penalize(penalty);
            } catch (RuntimeException ex) {
                last = ex;
                String msg = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
                if (isRetryableTransport(msg)) {
                    log.warn("[web3 failover] Transport retryable on {}: {}", ep.url, ex.toString());
                    ep.penalize(penalty);
                } else {
                    // non-retryable (e.g., contract revert) -> fail fast
                    log.error("[web3 failover] Non-retryable on {}: {}", ep.url, ex.toString());
                    throw ex;
                }
            }

            tried++;
            if (tried < total) backoff(tried);
        }

        if (last != null) throw last;
        throw new IllegalStateException("All RPC endpoints of network=" + network + " are penalized");
    }

    private void backoff(int attempt) {
        try {
            long pow = Math.min(attempt, 4);
            long delay = Math.min(baseBackoff.toMillis() * (1L << pow), maxBackoff.toMillis());
            Thread.sleep(delay);
        } catch (InterruptedException ignore) {
            Thread.currentThread().interrupt();
        }
    }

    static boolean isRetryableTransport(String msg) {
        if (msg.isEmpty()) return true;
        // heuristics for public RPCs
        return msg.contains("429") ||
                msg.contains("rate limit") ||
                msg.contains("over rate") ||
                msg.contains("1015") ||
                msg.contains("timeout") ||
                msg.contains("connection") ||
                msg.contains("refused") ||
                msg.contains("unexpected end of stream");
    }

    private List<Endpoint> getOrInit(String network) {
        return endpointsByNet.computeIfAbsent(network, net -> {
            var netCfg = props.require(net);
            var urls = netCfg.getRpcUrls();
            if (urls == null || urls.isEmpty()) return List.of();
            List<Endpoint> list = new ArrayList<>(urls.size());
            for (String u : urls) list.add(new Endpoint(u, clientBuilder.apply(u)));
            log.info("Initialized {} RPC endpoints for {}: {}", list.size(), net, urls);
            return list;
        });
    }
}
