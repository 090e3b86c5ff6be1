package com.color.x.dto.enums;

public enum SolutionStatus {
    FEASIBLE,
    TIMEOUT,
    ERROR
}
