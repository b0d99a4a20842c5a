package com.stablemint.event;

import lombok.Value;

import java.math.BigInteger;

/** Emitted on every collateral-decreasing transfer, liquidations included ({@code from != to}). */
@Value
public class CollateralRedeemedEvent {
    String from;
    String to;
    String asset;
    BigInteger amount;
}
