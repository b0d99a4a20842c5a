package com.stablemint.token;

import java.math.BigInteger;

/**
 * The minted stable unit. Only its owner (the engine's custody account) mints and burns.
 */
public interface StableToken {

    String address();

    /** @return false if the token reports failure */
    boolean mint(String to, BigInteger amount);

    /** Destroys {@code amount} from the owner's balance. */
    void burn(BigInteger amount);

    /** @return false if the token declined the transfer */
    boolean transferFrom(String from, String to, BigInteger amount);

    BigInteger balanceOf(String holder);

    BigInteger totalSupply();
}
