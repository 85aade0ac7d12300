package com.linemind.planning.exception;

import com.linemind.planning.domain.ErrorCode;

public class UnboundedModelException extends PlanningException {
    public UnboundedModelException(String message) {
        super(ErrorCode.UNBOUNDED_MODEL_ERROR, message, "check unit costs and capacities for missing bounds");
    }
}
