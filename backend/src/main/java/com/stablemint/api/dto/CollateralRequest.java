package com.stablemint.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

/** Deposit or redeem of one collateral token; amount in the token's smallest unit. */
@Data
public class CollateralRequest {
    @NotBlank
    private String asset;
    @NotNull
    private BigInteger amount;
}
