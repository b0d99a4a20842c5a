package com.stablemint.exception;

/** Price feed returned nothing usable: stale, non-positive, unsupported, or unreachable. */
public class OracleException extends BaseException {

    public OracleException(String message) {
        super(ErrorCode.ORACLE_FAILURE, message);
    }

    public OracleException(String message, Throwable cause) {
        super(ErrorCode.ORACLE_FAILURE, message, cause);
    }
}
