package com.linemind.planning.exception;

import com.linemind.planning.domain.ErrorCode;

public class InfeasibleModelException extends PlanningException {
    public InfeasibleModelException(String message, String suggestion) {
        super(ErrorCode.INFEASIBLE_MODEL_ERROR, message, suggestion);
    }
}
