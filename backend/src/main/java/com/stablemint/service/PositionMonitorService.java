package com.stablemint.service;

import com.stablemint.engine.AccountSnapshot;
import com.stablemint.engine.DscEngine;
import com.stablemint.engine.SolvencyCalculator;
import com.stablemint.model.PositionSnapshot;
import com.stablemint.repo.PositionSnapshotRepo;
import com.stablemint.util.FixedPointMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.stablemint.engine.EngineConstants.PRECISION;

/**
 * Walks every known actor, prices its position and stores a snapshot in MongoDB.
 * Actors whose health factor is below the minimum are reported as liquidatable.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PositionMonitorService {

    private final DscEngine engine;
    private final PositionSnapshotRepo snapshotRepo;
    private final Clock clock;

    /**
     * @return snapshots written by this run
     */
    public List<PositionSnapshot> pollPositions() {
        Instant ts = clock.instant();
        List<PositionSnapshot> batch = new ArrayList<>();

        for (String actor : engine.getKnownActors()) {
            try {
                AccountSnapshot account = engine.getAccountInformation(actor);
                BigInteger hf = SolvencyCalculator.calculateHealthFactor(
                        account.getTotalDscMinted(), account.getCollateralValueInUsd());
                boolean liquidatable = !SolvencyCalculator.isHealthy(hf);

                batch.add(PositionSnapshot.builder()
                        .actor(actor)
                        .ts(ts)
                        .debt(account.getTotalDscMinted().toString())
                        .collateralValueUsd(account.getCollateralValueInUsd().toString())
                        .healthFactor(hf.toString())
                        .healthFactorRatio(toRatio(hf))
                        .liquidatable(liquidatable)
                        .build());

                if (liquidatable) {
                    log.warn("[monitor] {} is liquidatable: hf={} debt={} collateralUsd={}",
                            actor, hf, account.getTotalDscMinted(), account.getCollateralValueInUsd());
                }
            } catch (RuntimeException ex) {
                // Log and continue with other actors; one bad price must not stop the whole run.
                log.error("[monitor] failed to snapshot {}: {}", actor, ex.getMessage());
            }
        }

        if (!batch.isEmpty()) snapshotRepo.saveAll(batch);
        log.info("[monitor] stored {} position snapshots at {}", batch.size(), ts);
        return batch;
    }

    static double toRatio(BigInteger healthFactor) {
        if (healthFactor.equals(FixedPointMath.MAX_UINT256)) return Double.POSITIVE_INFINITY;
        return new BigDecimal(healthFactor).divide(new BigDecimal(PRECISION)).doubleValue();
    }
}
