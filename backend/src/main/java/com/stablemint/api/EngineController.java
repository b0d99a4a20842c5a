package com.stablemint.api;

import com.stablemint.api.dto.CollateralAndDscRequest;
import com.stablemint.api.dto.CollateralRequest;
import com.stablemint.api.dto.DscAmountRequest;
import com.stablemint.api.dto.EngineInfoResponse;
import com.stablemint.api.dto.LiquidationRequest;
import com.stablemint.engine.DscEngine;
import com.stablemint.engine.EngineConstants;
import com.stablemint.engine.LiquidationResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public operation surface. The acting account is taken from the X-Actor-Address header.
 */
@RestController
@RequestMapping("/api/v1/engine")
@RequiredArgsConstructor
public class EngineController {

    public static final String ACTOR_HEADER = "X-Actor-Address";

    private final DscEngine engine;

    @PostMapping("/deposit")
    public ResponseEntity<Void> deposit(@RequestHeader(ACTOR_HEADER) String actor,
                                        @Validated @RequestBody CollateralRequest req) {
        engine.depositCollateral(actor, req.getAsset(), req.getAmount());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/mint")
    public ResponseEntity<Void> mint(@RequestHeader(ACTOR_HEADER) String actor,
                                     @Validated @RequestBody DscAmountRequest req) {
        engine.mintDsc(actor, req.getAmount());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/deposit-and-mint")
    public ResponseEntity<Void> depositAndMint(@RequestHeader(ACTOR_HEADER) String actor,
                                               @Validated @RequestBody CollateralAndDscRequest req) {
        engine.depositCollateralAndMintDsc(actor, req.getAsset(), req.getCollateralAmount(), req.getDscAmount());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/redeem")
    public ResponseEntity<Void> redeem(@RequestHeader(ACTOR_HEADER) String actor,
                                       @Validated @RequestBody CollateralRequest req) {
        engine.redeemCollateral(actor, req.getAsset(), req.getAmount());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/burn")
    public ResponseEntity<Void> burn(@RequestHeader(ACTOR_HEADER) String actor,
                                     @Validated @RequestBody DscAmountRequest req) {
        engine.burnDsc(actor, req.getAmount());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/redeem-for-dsc")
    public ResponseEntity<Void> redeemForDsc(@RequestHeader(ACTOR_HEADER) String actor,
                                             @Validated @RequestBody CollateralAndDscRequest req) {
        engine.redeemCollateralForDsc(actor, req.getAsset(), req.getCollateralAmount(), req.getDscAmount());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/liquidate")
    public LiquidationResult liquidate(@RequestHeader(ACTOR_HEADER) String liquidator,
                                       @Validated @RequestBody LiquidationRequest req) {
        return engine.liquidate(liquidator, req.getAsset(), req.getTarget(), req.getDebtToCover());
    }

    @GetMapping("/info")
    public EngineInfoResponse info() {
        Map<String, String> feeds = new LinkedHashMap<>();
        for (String asset : engine.getCollateralTokens()) {
            feeds.put(asset, engine.getCollateralTokenPriceFeed(asset));
        }
        return EngineInfoResponse.builder()
                .stableToken(engine.getStableToken())
                .collateralPriceFeeds(feeds)
                .precision(EngineConstants.PRECISION)
                .additionalFeedPrecision(EngineConstants.ADDITIONAL_FEED_PRECISION)
                .liquidationThreshold(EngineConstants.LIQUIDATION_THRESHOLD)
                .liquidationPrecision(EngineConstants.LIQUIDATION_PRECISION)
                .liquidationBonus(EngineConstants.LIQUIDATION_BONUS)
                .minHealthFactor(EngineConstants.MIN_HEALTH_FACTOR)
                .build();
    }
}
