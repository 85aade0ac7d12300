package com.linemind.planning.domain;

public enum Shift {
    DAY,
    NIGHT
}
