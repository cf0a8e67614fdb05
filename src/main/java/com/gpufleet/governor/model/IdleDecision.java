package com.gpufleet.governor.model;

public enum IdleDecision {
    NO_DATA,
    INSUFFICIENT_DATA,
    ACTIVE,
    IDLE,
    IDLE_WARNING,
    MIN_RUNTIME_NOT_MET,
    ALLOWLISTED,
    TERMINATE
}
