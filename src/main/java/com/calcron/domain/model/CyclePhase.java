package com.calcron.domain.model;

public enum CyclePhase {
    IDLE,
    FETCHING,
    RECONCILING,
    APPLYING,
    PERSISTING
}
