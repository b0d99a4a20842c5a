package com.stablemint.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

/** Mint or burn of stable units (18 decimals). */
@Data
public class DscAmountRequest {
    @NotNull
    private BigInteger amount;
}
