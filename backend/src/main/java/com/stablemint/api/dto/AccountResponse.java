package com.stablemint.api.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigInteger;
import java.util.Map;

@Data
@Builder
public class AccountResponse {
    private String actor;
    private BigInteger totalDscMinted;
    private BigInteger collateralValueInUsd;
    private BigInteger healthFactor;
    private boolean liquidatable;
    /** Deposited amount per registered collateral token. */
    private Map<String, BigInteger> collateral;
}
