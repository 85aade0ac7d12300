package com.linemind.planning.exception;

import com.linemind.planning.domain.Diagnostic;
import com.linemind.planning.domain.ErrorCode;
import lombok.Getter;

@Getter
public abstract class PlanningException extends RuntimeException {
    private final ErrorCode errorCode;
    private final String suggestion;

    protected PlanningException(ErrorCode errorCode, String message, String suggestion) {
        super(message);
        this.errorCode = errorCode;
        this.suggestion = suggestion;
    }

    protected PlanningException(ErrorCode errorCode, String message, String suggestion, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.suggestion = suggestion;
    }

    public Diagnostic toDiagnostic() {
        return Diagnostic.builder()
                .code(errorCode)
                .message(getMessage())
                .suggestion(suggestion)
                .build();
    }
}
