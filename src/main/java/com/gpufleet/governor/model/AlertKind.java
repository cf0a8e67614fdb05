package com.gpufleet.governor.model;

public enum AlertKind {
    MILESTONE,
    BUDGET_EXCEEDED
}
