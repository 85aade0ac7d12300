package com.linemind.planning.engine;

import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.linemind.planning.exception.InfeasibleModelException;
import com.linemind.planning.exception.PlanningException;
import com.linemind.planning.exception.SolverTimeoutException;
import com.linemind.planning.exception.SolverUnavailableException;
import com.linemind.planning.exception.UnboundedModelException;

/**
 * Lifecycle of an exact model: BUILT, then SOLVING, then one of the terminal states.
 * Only OPTIMAL and FEASIBLE carry a solution worth extracting.
 */
public enum SolverStatus {
    BUILT,
    SOLVING,
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    UNBOUNDED,
    TIMEOUT,
    SOLVER_UNAVAILABLE;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }

    public boolean isTerminal() {
        return this != BUILT && this != SOLVING;
    }

    /**
     * NOT_SOLVED is what SCIP reports when the time limit expires before any incumbent exists.
     */
    public static SolverStatus fromLinearSolver(MPSolver.ResultStatus status) {
        return switch (status) {
            case OPTIMAL -> OPTIMAL;
            case FEASIBLE -> FEASIBLE;
            case INFEASIBLE -> INFEASIBLE;
            case UNBOUNDED -> UNBOUNDED;
            case NOT_SOLVED -> TIMEOUT;
            default -> SOLVER_UNAVAILABLE; // ABNORMAL, MODEL_INVALID
        };
    }

    public static SolverStatus fromCpSat(CpSolverStatus status) {
        return switch (status) {
            case OPTIMAL -> OPTIMAL;
            case FEASIBLE -> FEASIBLE;
            case INFEASIBLE -> INFEASIBLE;
            case UNKNOWN -> TIMEOUT;
            default -> SOLVER_UNAVAILABLE; // MODEL_INVALID, UNRECOGNIZED
        };
    }

    /**
     * Failure to report for a terminal state without a solution.
     */
    public PlanningException toFailure(double timeLimitSec, String infeasibleMessage, String infeasibleSuggestion) {
        return switch (this) {
            case INFEASIBLE -> new InfeasibleModelException(infeasibleMessage, infeasibleSuggestion);
            case UNBOUNDED -> new UnboundedModelException("model is unbounded");
            case TIMEOUT -> new SolverTimeoutException(timeLimitSec);
            case SOLVER_UNAVAILABLE -> new SolverUnavailableException("solver backend failed to produce a result");
            default -> throw new IllegalStateException("No failure for solver status " + this);
        };
    }
}
