package com.stablemint.engine;

import lombok.Value;

import java.math.BigInteger;

/** Debt and discount-free collateral value of one actor at one instant. */
@Value
public class AccountSnapshot {
    BigInteger totalDscMinted;
    BigInteger collateralValueInUsd;
}
