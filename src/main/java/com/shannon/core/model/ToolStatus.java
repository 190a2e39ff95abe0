package com.shannon.core.model;

public enum ToolStatus {
    SUCCESS,
    FAILED,
    SKIPPED
}
