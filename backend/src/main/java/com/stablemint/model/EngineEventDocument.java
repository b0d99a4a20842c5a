package com.stablemint.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Journal entry for a committed engine event.
 * Amounts are kept as decimal strings since they are uint256 values.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("engine_events")
public class EngineEventDocument {

    @Id
    private String id;

    /** COLLATERAL_DEPOSITED or COLLATERAL_REDEEMED. */
    @Indexed
    private String type;

    /** Depositor, or the actor whose collateral left. */
    @Indexed
    private String fromAddress;

    /** Recipient of redeemed collateral; null for deposits. */
    private String toAddress;

    @Indexed
    private String asset;

    private String amount;

    @Indexed
    private Instant ts;
}
