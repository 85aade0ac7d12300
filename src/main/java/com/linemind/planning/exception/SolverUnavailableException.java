package com.linemind.planning.exception;

import com.linemind.planning.domain.ErrorCode;

/**
 * The exact backend could not be initialized. Callers may fall back to the heuristic strategy.
 */
public class SolverUnavailableException extends PlanningException {
    public SolverUnavailableException(String message) {
        super(ErrorCode.SOLVER_UNAVAILABLE_ERROR, message, "retry with the heuristic strategy");
    }

    public SolverUnavailableException(String message, Throwable cause) {
        super(ErrorCode.SOLVER_UNAVAILABLE_ERROR, message, "retry with the heuristic strategy", cause);
    }
}
