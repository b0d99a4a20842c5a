package com.stablemint.event;

import com.stablemint.model.EngineEventDocument;
import com.stablemint.repo.EngineEventRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Persists committed engine events to the engine_events collection.
 * Events arrive after the operation has committed, so a journal write failure cannot undo it;
 * it is logged with the full event instead.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EngineEventRecorder {

    public static final String COLLATERAL_DEPOSITED = "COLLATERAL_DEPOSITED";
    public static final String COLLATERAL_REDEEMED = "COLLATERAL_REDEEMED";

    private final EngineEventRepo repo;
    private final Clock clock;

    @EventListener
    public void onDeposited(CollateralDepositedEvent e) {
        save(EngineEventDocument.builder()
                .type(COLLATERAL_DEPOSITED)
                .fromAddress(e.getActor())
                .asset(e.getAsset())
                .amount(e.getAmount().toString())
                .ts(clock.instant())
                .build(), e);
    }

    @EventListener
    public void onRedeemed(CollateralRedeemedEvent e) {
        save(EngineEventDocument.builder()
                .type(COLLATERAL_REDEEMED)
                .fromAddress(e.getFrom())
                .toAddress(e.getTo())
                .asset(e.getAsset())
                .amount(e.getAmount().toString())
                .ts(clock.instant())
                .build(), e);
    }

    private void save(EngineEventDocument doc, Object event) {
        try {
            repo.save(doc);
            log.debug("[events] recorded {}", event);
        } catch (DataAccessException ex) {
            log.error("[events] failed to journal {}: {}", event, ex.getMessage());
        }
    }
}
