package com.storylens.highlight;

public enum SchedulerState {
    IDLE,
    PENDING,
    SCANNING,
    APPLYING
}
