package com.stablemint.event;

import lombok.Value;

import java.math.BigInteger;

@Value
public class CollateralDepositedEvent {
    String actor;
    String asset;
    BigInteger amount;
}
