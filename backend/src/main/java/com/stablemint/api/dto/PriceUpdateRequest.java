package com.stablemint.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

/** New answer for a static feed, 8 decimals (e.g. 200000000000 = 2000 USD). */
@Data
public class PriceUpdateRequest {
    @NotBlank
    private String feed;
    @NotNull
    private BigInteger answer;
}
