package com.whereq.orchestra.model;

public enum PlaybookStatus {
    DRAFT,
    VALIDATED,
    INVALID
}
