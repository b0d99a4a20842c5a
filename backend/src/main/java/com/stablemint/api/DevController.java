package com.stablemint.api;

import com.stablemint.api.dto.FaucetRequest;
import com.stablemint.api.dto.PriceUpdateRequest;
import com.stablemint.exception.EngineException;
import com.stablemint.exception.ErrorCode;
import com.stablemint.oracle.StaticPriceFeed;
import com.stablemint.token.InMemoryTokenBank;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Local-run helpers: mint collateral tokens and move static feed prices. Only present with app.dev.enabled=true.
 */
@RestController
@RequestMapping("/api/v1/dev")
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.dev", name = "enabled", havingValue = "true")
public class DevController {

    private final InMemoryTokenBank tokenBank;
    private final ObjectProvider<StaticPriceFeed> staticPriceFeed;

    @PostMapping("/faucet")
    public ResponseEntity<Void> faucet(@Validated @RequestBody FaucetRequest req) {
        tokenBank.credit(req.getToken(), req.getHolder(), req.getAmount());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/prices")
    public ResponseEntity<Void> setPrice(@Validated @RequestBody PriceUpdateRequest req) {
        StaticPriceFeed feed = staticPriceFeed.getIfAvailable();
        if (feed == null) {
            throw new EngineException(ErrorCode.BAD_REQUEST, "Price override needs app.oracle.source=static");
        }
        feed.updateAnswer(req.getFeed(), req.getAnswer());
        return ResponseEntity.noContent().build();
    }
}
