package com.linemind.planning.exception;

import com.linemind.planning.domain.ErrorCode;

public class SolverTimeoutException extends PlanningException {
    public SolverTimeoutException(double timeLimitSec) {
        super(ErrorCode.SOLVER_TIMEOUT_ERROR,
              String.format("solver hit the %.1f s time limit without a solution", timeLimitSec),
              "reduce the problem size or increase the solver time limit");
    }
}
