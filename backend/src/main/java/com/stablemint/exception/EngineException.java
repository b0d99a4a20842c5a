package com.stablemint.exception;

import java.util.Map;

/** Any engine failure that aborts the current operation. */
public class EngineException extends BaseException {

    public EngineException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public EngineException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public EngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
