package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Diagnostic {
    ErrorCode code;
    String message;
    String suggestion; // may be null
}
