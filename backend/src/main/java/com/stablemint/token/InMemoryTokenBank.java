package com.stablemint.token;

import com.stablemint.util.AddressUtil;
import com.stablemint.util.FixedPointMath;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Balances of every collateral token, kept in process. Used for local runs and tests.
 */
@Slf4j
public class InMemoryTokenBank implements CollateralTokenGateway {

    private final Map<String, Map<String, BigInteger>> balances = new HashMap<>();

    /** Faucet: creates {@code amount} of {@code token} for {@code holder}. */
    public synchronized void credit(String token, String holder, BigInteger amount) {
        String t = AddressUtil.normalize(token);
        String h = AddressUtil.normalize(holder);
        FixedPointMath.requireUint256(amount, "amount");
        balances.computeIfAbsent(t, k -> new HashMap<>()).merge(h, amount, FixedPointMath::add);
        log.info("[token-bank] credited {} of {} to {}", amount, t, h);
    }

    @Override
    public synchronized boolean transferFrom(String token, String from, String to, BigInteger amount) {
        Map<String, BigInteger> book = balances.computeIfAbsent(token, k -> new HashMap<>());
        BigInteger available = book.getOrDefault(from, BigInteger.ZERO);
        if (amount.signum() < 0 || available.compareTo(amount) < 0) {
            log.debug("[token-bank] declined {} of {} from {} (balance {})", amount, token, from, available);
            return false;
        }
        book.put(from, available.subtract(amount));
        book.merge(to, amount, FixedPointMath::add);
        return true;
    }

    @Override
    public synchronized BigInteger balanceOf(String token, String holder) {
        Map<String, BigInteger> book = balances.get(token);
        return book == null ? BigInteger.ZERO : book.getOrDefault(holder, BigInteger.ZERO);
    }
}
