package com.stablemint.token;

import java.math.BigInteger;

/**
 * Fungible collateral tokens addressed by token address.
 */
public interface CollateralTokenGateway {

    /**
     * Move {@code amount} of {@code token} from {@code from} to {@code to}.
     *
     * @return false if the token declined the transfer
     */
    boolean transferFrom(String token, String from, String to, BigInteger amount);

    BigInteger balanceOf(String token, String holder);
}
