package com.stablemint.api;

import com.stablemint.api.dto.AccountResponse;
import com.stablemint.engine.AccountSnapshot;
import com.stablemint.engine.DscEngine;
import com.stablemint.engine.SolvencyCalculator;
import com.stablemint.util.AddressUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * Read-only views of actor positions.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final DscEngine engine;

    @GetMapping("/{actor}")
    public AccountResponse account(@PathVariable String actor) {
        AccountSnapshot s = engine.getAccountInformation(actor);
        BigInteger hf = engine.calculateHealthFactor(s.getTotalDscMinted(), s.getCollateralValueInUsd());
        return AccountResponse.builder()
                .actor(AddressUtil.normalize(actor))
                .totalDscMinted(s.getTotalDscMinted())
                .collateralValueInUsd(s.getCollateralValueInUsd())
                .healthFactor(hf)
                .liquidatable(!SolvencyCalculator.isHealthy(hf))
                .collateral(engine.getCollateralBalances(actor))
                .build();
    }

    @GetMapping("/{actor}/collateral/{asset}")
    public BigInteger collateralBalance(@PathVariable String actor, @PathVariable String asset) {
        return engine.getCollateralBalanceOfUser(actor, asset);
    }

    /** Pure health factor of arbitrary (debt, collateral USD) figures. */
    @GetMapping("/health-factor")
    public BigInteger calculateHealthFactor(@RequestParam BigInteger debt, @RequestParam BigInteger collateralUsd) {
        return engine.calculateHealthFactor(debt, collateralUsd);
    }
}
