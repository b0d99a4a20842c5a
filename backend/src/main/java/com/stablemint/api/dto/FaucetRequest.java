package com.stablemint.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigInteger;

@Data
public class FaucetRequest {
    @NotBlank
    private String token;
    @NotBlank
    private String holder;
    @NotNull
    private BigInteger amount;
}
