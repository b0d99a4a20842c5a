package com.stablemint.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

@Data
public class LiquidationRequest {
    /** Collateral token to seize. */
    @NotBlank
    private String asset;
    /** Actor whose position is liquidated. */
    @NotBlank
    private String target;
    /** Stable units repaid on the target's behalf (18 decimals). */
    @NotNull
    private BigInteger debtToCover;
}
