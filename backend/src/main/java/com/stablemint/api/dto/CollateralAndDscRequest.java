package com.stablemint.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

/**
 * Composite request: deposit + mint, or burn + redeem.
 * {@code dscAmount} is the amount minted or burned.
 */
@Data
public class CollateralAndDscRequest {
    @NotBlank
    private String asset;
    @NotNull
    private BigInteger collateralAmount;
    @NotNull
    private BigInteger dscAmount;
}
