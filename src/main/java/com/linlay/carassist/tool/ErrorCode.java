package com.linlay.carassist.tool;

public enum ErrorCode {
    INVALID_INPUT,
    NOT_FOUND,
    AMBIGUOUS,
    FORBIDDEN,
    PRECONDITION_FAILED,
    CONFLICT,
    TIME_ALREADY_BOOKED,
    TXN_FAILED,
    DB_UNAVAILABLE,
    PLANNER_FAIL,
    PLAN_INVALID
}
