package com.stablemint.ledger;

import com.stablemint.exception.EngineException;
import com.stablemint.exception.ErrorCode;
import com.stablemint.util.FixedPointMath;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deposited collateral per (actor, asset). No solvency awareness; callers decide whether a change is allowed.
 */
public class CollateralLedger {

    private final List<String> registeredAssets;
    private final Set<String> registered;
    private final Map<String, Map<String, BigInteger>> balances = new LinkedHashMap<>();

    public CollateralLedger(List<String> registeredAssets) {
        this.registeredAssets = List.copyOf(registeredAssets);
        this.registered = Set.copyOf(registeredAssets);
    }

    public List<String> registeredAssets() {
        return registeredAssets;
    }

    public boolean isRegistered(String asset) {
        return registered.contains(asset);
    }

    public void requireRegistered(String asset) {
        if (!isRegistered(asset)) {
            throw new EngineException(ErrorCode.UNREGISTERED_ASSET, "Asset is not registered: " + asset,
                    Map.of("asset", asset));
        }
    }

    public void deposit(UndoJournal journal, String actor, String asset, BigInteger amount) {
        requirePositive(amount);
        requireRegistered(asset);
        BigInteger before = balanceOf(actor, asset);
        put(actor, asset, FixedPointMath.add(before, amount));
        journal.record("collateral.deposit " + actor + " " + asset, () -> put(actor, asset, before));
    }

    public void withdraw(UndoJournal journal, String actor, String asset, BigInteger amount) {
        requirePositive(amount);
        BigInteger before = balanceOf(actor, asset);
        if (amount.compareTo(before) > 0) {
            throw new EngineException(ErrorCode.INSUFFICIENT_COLLATERAL,
                    "Withdrawal of " + amount + " exceeds deposited " + before,
                    Map.of("asset", asset, "requested", amount.toString(), "available", before.toString()));
        }
        put(actor, asset, FixedPointMath.sub(before, amount));
        journal.record("collateral.withdraw " + actor + " " + asset, () -> put(actor, asset, before));
    }

    public BigInteger balanceOf(String actor, String asset) {
        Map<String, BigInteger> perAsset = balances.get(actor);
        if (perAsset == null) return BigInteger.ZERO;
        return perAsset.getOrDefault(asset, BigInteger.ZERO);
    }

    /** Balances of every registered asset for the actor, in registration order, zeros included. */
    public Map<String, BigInteger> balancesOf(String actor) {
        Map<String, BigInteger> out = new LinkedHashMap<>();
        for (String asset : registeredAssets) out.put(asset, balanceOf(actor, asset));
        return out;
    }

    /** Sum over all actors of one asset. */
    public BigInteger totalOf(String asset) {
        BigInteger total = BigInteger.ZERO;
        for (Map<String, BigInteger> perAsset : balances.values()) {
            total = FixedPointMath.add(total, perAsset.getOrDefault(asset, BigInteger.ZERO));
        }
        return total;
    }

    public Set<String> actors() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(balances.keySet()));
    }

    private void put(String actor, String asset, BigInteger value) {
        balances.computeIfAbsent(actor, k -> new HashMap<>()).put(asset, value);
    }

    static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new EngineException(ErrorCode.INVALID_INPUT, "Amount must be more than zero",
                    Map.of("amount", String.valueOf(amount)));
        }
    }
}
