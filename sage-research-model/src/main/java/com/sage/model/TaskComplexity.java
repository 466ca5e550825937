package com.sage.model;

public enum TaskComplexity {
    LOW,
    MEDIUM,
    HIGH
}
