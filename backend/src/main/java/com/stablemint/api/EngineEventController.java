package com.stablemint.api;

import com.stablemint.event.EngineEventRecorder;
import com.stablemint.exception.EngineException;
import com.stablemint.exception.ErrorCode;
import com.stablemint.model.EngineEventDocument;
import com.stablemint.repo.EngineEventRepo;
import com.stablemint.util.AddressUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only access to the journal of committed collateral events.
 */
@RestController
@RequestMapping("/api/v1/engine/events")
@RequiredArgsConstructor
public class EngineEventController {

    private static final Set<String> TYPES =
            Set.of(EngineEventRecorder.COLLATERAL_DEPOSITED, EngineEventRecorder.COLLATERAL_REDEEMED);

    private final EngineEventRepo repo;

    /** Deposits and redemptions whose collateral came from or left the given actor's position. */
    @GetMapping(params = "actor")
    public List<EngineEventDocument> byActor(@RequestParam String actor) {
        return repo.findByFromAddressOrderByTsAsc(AddressUtil.normalize(actor));
    }

    @GetMapping(params = {"asset", "type"})
    public List<EngineEventDocument> byAssetAndType(@RequestParam String asset, @RequestParam String type) {
        String t = type.trim().toUpperCase(Locale.ROOT);
        if (!TYPES.contains(t)) {
            throw new EngineException(ErrorCode.BAD_REQUEST, "Unknown event type: " + type,
                    Map.of("type", type, "allowed", TYPES));
        }
        return repo.findByAssetAndTypeOrderByTsAsc(AddressUtil.normalize(asset), t);
    }
}
