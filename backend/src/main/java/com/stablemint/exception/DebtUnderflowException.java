package com.stablemint.exception;

import java.math.BigInteger;
import java.util.Map;
import lombok.Getter;

/**
 * Raised when a debt decrease (burn or liquidation repayment) asks for more than the actor owes.
 * Carries both numbers so callers can report the gap.
 */
@Getter
public class DebtUnderflowException extends BaseException {

    private final BigInteger requested;
    private final BigInteger available;

    public DebtUnderflowException(BigInteger requested, BigInteger available) {
        super(ErrorCode.DEBT_UNDERFLOW,
                "Requested " + requested + " exceeds outstanding debt " + available,
                Map.of("requested", requested.toString(), "available", available.toString()));
        this.requested = requested;
        this.available = available;
    }
}
