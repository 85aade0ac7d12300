package com.linemind.planning.exception;

import com.linemind.planning.domain.ErrorCode;

/**
 * Upstream data is malformed or incomplete. Raised before any model is built.
 */
public class DataShapeException extends PlanningException {
    public DataShapeException(String message) {
        super(ErrorCode.DATA_SHAPE_ERROR, message, "fix the input data and retry");
    }

    public DataShapeException(String message, Throwable cause) {
        super(ErrorCode.DATA_SHAPE_ERROR, message, "fix the input data and retry", cause);
    }
}
