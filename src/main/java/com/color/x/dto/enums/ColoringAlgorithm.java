package com.color.x.dto.enums;

public enum ColoringAlgorithm {
    DSATUR("DSaturColoringStrategy"),
    PROBABILISTIC("ProbabilisticColoringStrategy");

    private final String mode;

    ColoringAlgorithm(String mode) {
        this.mode = mode;
    }

    public String mode() {
        return mode;
    }
}
