package com.calcron.domain.model;

public enum ActionType {
    SCHEDULE,
    RESCHEDULE,
    CANCEL,
    NOOP
}
