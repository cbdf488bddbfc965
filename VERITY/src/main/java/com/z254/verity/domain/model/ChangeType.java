package com.z254.verity.domain.model;

public enum ChangeType {
    SPIKE,
    DROP,
    OSCILLATION,
    SUSTAINED_SHIFT
}
