package com.dicalc.domain.model;

public enum WarningCode {
    UNAPPLIED_REMAINDER,
    RATE_FORWARD_FILLED
}
