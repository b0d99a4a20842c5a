package com.stablemint.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Time-series snapshot of one actor's position, taken by the position monitor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("position_snapshots")
public class PositionSnapshot {

    @Id
    private String id;

    @Indexed
    private String actor;

    /** UTC timestamp of the monitor run (shared by all actors of one run). */
    @Indexed
    private Instant ts;

    /** Outstanding stable units, 18 decimals, as decimal string. */
    private String debt;

    /** Undiscounted collateral value in USD, 18 decimals, as decimal string. */
    private String collateralValueUsd;

    /** Health factor, 18 decimals, as decimal string (2^256-1 when there is no debt). */
    private String healthFactor;

    /** Health factor as a plain ratio, for charts; Infinity when there is no debt. */
    private double healthFactorRatio;

    @Indexed
    private boolean liquidatable;
}
