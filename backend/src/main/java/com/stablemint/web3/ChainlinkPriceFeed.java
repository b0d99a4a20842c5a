package com.stablemint.web3;

import com.stablemint.exception.OracleException;
import com.stablemint.oracle.PriceFeed;
import com.stablemint.oracle.PriceReading;
import com.stablemint.web3.exception.RetryableRpcException;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Int256;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint80;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads Chainlink aggregator rounds on-chain with RPC failover.
 *
 * <p>{@code decimals()} never changes for a deployed aggregator and is cached per feed.</p>
 */
@Slf4j
public class ChainlinkPriceFeed implements PriceFeed {

    private final Web3ClientFactory factory;
    private final String network;
    private final Map<String, Integer> decimalsByFeed = new ConcurrentHashMap<>();

    public ChainlinkPriceFeed(Web3ClientFactory factory, String network) {
        this.factory = factory;
        this.network = network;
    }

    @Override
    public PriceReading latestRoundData(String feedAddress) {
        try {
            return factory.executeWithFailover(network, web3 -> {
                int decimals = decimalsByFeed.computeIfAbsent(feedAddress, f -> fetchDecimals(web3, f));
                List<Type> out = call(web3, feedAddress, latestRoundDataFunction());
                PriceReading reading = PriceReading.builder()
                        .roundId((BigInteger) out.get(0).getValue())
                        .answer((BigInteger) out.get(1).getValue())
                        .startedAt(((BigInteger) out.get(2).getValue()).longValueExact())
                        .updatedAt(((BigInteger) out.get(3).getValue()).longValueExact())
                        .answeredInRound((BigInteger) out.get(4).getValue())
                        .decimals(decimals)
                        .build();
                log.debug("[chainlink] feed={} round={} answer={} updatedAt={}",
                        feedAddress, reading.getRoundId(), reading.getAnswer(), reading.getUpdatedAt());
                return reading;
            });
        } catch (OracleException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OracleException("Cannot read feed " + feedAddress + " on " + network + ": " + e.getMessage(), e);
        }
    }

    private int fetchDecimals(Web3j web3, String feedAddress) {
        Function f = new Function("decimals", Collections.emptyList(),
                Collections.singletonList(new TypeReference<Uint8>() {}));
        List<Type> out = call(web3, feedAddress, f);
        return ((BigInteger) out.get(0).getValue()).intValueExact();
    }

    static Function latestRoundDataFunction() {
        return new Function("latestRoundData", Collections.emptyList(),
                Arrays.asList(
                        new TypeReference<Uint80>() {},
                        new TypeReference<Int256>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Uint256>() {},
                        new TypeReference<Uint80>() {}));
    }

    private List<Type> call(Web3j web3, String feedAddress, Function fn) {
        EthCall call;
        try {
            call = web3.ethCall(
                    Transaction.createEthCallTransaction(null, feedAddress, FunctionEncoder.encode(fn)),
                    DefaultBlockParameterName.LATEST).send();
        } catch (IOException e) {
            throw new RetryableRpcException("transport failure on " + fn.getName() + ": " + e.getMessage(), e);
        }
        if (call.hasError() && isRateLimited(call.getError().getMessage())) {
            throw new RetryableRpcException("rate-limited on " + fn.getName() + ": " + call.getError().getMessage());
        }
        if (call.isReverted() || call.hasError()) {
            throw new OracleException("Feed " + feedAddress + " " + fn.getName() + " reverted: "
                    + (call.hasError() ? call.getError().getMessage() : call.getRevertReason()));
        }
        List<Type> out = FunctionReturnDecoder.decode(call.getValue(), fn.getOutputParameters());
        if (out.size() != fn.getOutputParameters().size()) {
            throw new OracleException("Feed " + feedAddress + " returned an unexpected " + fn.getName() + " payload");
        }
        return out;
    }

    /**
     * Heuristics to detect RPC rate-limit responses (public RPCs vary in messages).
     */
    private static boolean isRateLimited(String msg) {
        if (msg == null) return false;
        String m = msg.toLowerCase(Locale.ROOT);
        return m.contains("429") ||
                m.contains("rate limit") ||
                m.contains("over rate") ||
                m.contains("1015") ||
                m.contains("too many requests");
    }
}
