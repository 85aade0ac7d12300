package com.linemind.planning.domain;

public enum ErrorCode {
    DATA_SHAPE_ERROR,
    INFEASIBLE_MODEL_ERROR,
    SOLVER_TIMEOUT_ERROR,
    SOLVER_UNAVAILABLE_ERROR,
    UNBOUNDED_MODEL_ERROR,
    INTERNAL_ERROR
}
