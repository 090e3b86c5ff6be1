package com.color.x.coloring.strategies;

import com.color.x.dto.enums.ColoringAlgorithm;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class ColoringStrategyContext {
    private final List<ColoringStrategy> strategies;

    public ColoringStrategy resolve(String mode) {
        return strategies.stream()
                .filter(strategy -> strategy.supports(mode))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported coloring mode: " + mode));
    }

    public ColoringStrategy resolve(ColoringAlgorithm algorithm) {
        return resolve(algorithm.mode());
    }
}
