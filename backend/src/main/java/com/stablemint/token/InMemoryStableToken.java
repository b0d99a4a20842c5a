package com.stablemint.token;

import com.stablemint.util.AddressUtil;
import com.stablemint.util.FixedPointMath;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Burnable, mintable stable token kept in process. Mint and burn refuse zero amounts and the zero address;
 * burn only spends the owner's balance.
 */
public class InMemoryStableToken implements StableToken {

    private final String address;
    private final String owner;
    private final Map<String, BigInteger> balances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public InMemoryStableToken(String address, String owner) {
        this.address = AddressUtil.normalize(address);
        this.owner = AddressUtil.normalize(owner);
    }

    @Override
    public String address() {
        return address;
    }

    public String owner() {
        return owner;
    }

    @Override
    public synchronized boolean mint(String to, BigInteger amount) {
        if (AddressUtil.isZero(to)) throw new TokenException("Cannot mint to the zero address");
        if (amount.signum() <= 0) throw new TokenException("Mint amount must be more than zero");
        balances.merge(to, amount, FixedPointMath::add);
        totalSupply = FixedPointMath.add(totalSupply, amount);
        return true;
    }

    @Override
    public synchronized void burn(BigInteger amount) {
        if (amount.signum() <= 0) throw new TokenException("Burn amount must be more than zero");
        BigInteger balance = balanceOf(owner);
        if (balance.compareTo(amount) < 0) {
            throw new TokenException("Burn amount " + amount + " exceeds owner balance " + balance);
        }
        balances.put(owner, balance.subtract(amount));
        totalSupply = totalSupply.subtract(amount);
    }

    @Override
    public synchronized boolean transferFrom(String from, String to, BigInteger amount) {
        BigInteger available = balanceOf(from);
        if (amount.signum() < 0 || available.compareTo(amount) < 0) return false;
        balances.put(from, available.subtract(amount));
        balances.merge(to, amount, FixedPointMath::add);
        return true;
    }

    @Override
    public synchronized BigInteger balanceOf(String holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }
}
