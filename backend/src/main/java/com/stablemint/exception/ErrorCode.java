package com.stablemint.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INVALID_INPUT("INVALID_INPUT", 400),
    UNREGISTERED_ASSET("UNREGISTERED_ASSET", 400),
    INSUFFICIENT_COLLATERAL("INSUFFICIENT_COLLATERAL", 422),
    DEBT_UNDERFLOW("DEBT_UNDERFLOW", 422),
    HEALTH_FACTOR_BELOW_THRESHOLD("HEALTH_FACTOR_BELOW_THRESHOLD", 422),
    HEALTH_FACTOR_OK("HEALTH_FACTOR_OK", 409),
    HEALTH_FACTOR_NOT_IMPROVED("HEALTH_FACTOR_NOT_IMPROVED", 422),
    EXTERNAL_TRANSFER_UNDERFUNDED("EXTERNAL_TRANSFER_UNDERFUNDED", 422),
    ARITHMETIC_ERROR("ARITHMETIC_ERROR", 422),
    REENTRANT_CALL("REENTRANT_CALL", 409),
    MINT_FAILED("MINT_FAILED", 502),
    TRANSFER_FAILED("TRANSFER_FAILED", 502),
    ORACLE_FAILURE("ORACLE_FAILURE", 503),
    LENGTH_MISMATCH("LENGTH_MISMATCH", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
