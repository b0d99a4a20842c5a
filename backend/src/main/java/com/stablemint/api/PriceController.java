package com.stablemint.api;

import com.stablemint.engine.DscEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * Conversions between collateral amounts and USD at the current feed price.
 */
@RestController
@RequestMapping("/api/v1/prices")
@RequiredArgsConstructor
public class PriceController {

    private final DscEngine engine;

    @GetMapping("/{asset}/usd-value")
    public BigInteger usdValue(@PathVariable String asset, @RequestParam BigInteger amount) {
        return engine.getUsdValue(asset, amount);
    }

    @GetMapping("/{asset}/token-amount")
    public BigInteger tokenAmount(@PathVariable String asset, @RequestParam BigInteger usd) {
        return engine.getTokenAmountFromUsd(asset, usd);
    }
}
