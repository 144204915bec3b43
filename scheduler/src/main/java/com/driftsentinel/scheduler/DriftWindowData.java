package com.driftsentinel.scheduler;

import com.driftsentinel.core.model.BiasObservation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Production data for one drift check window.
 *
 * @param inputData  current feature samples by feature name
 * @param outputData current predictions
 * @param biasData   fairness measurements
 * @since 1.0.0
 */
public record DriftWindowData(
        Map<String, List<Double>> inputData,
        List<Double> outputData,
        List<BiasObservation> biasData) {

    private static final DriftWindowData EMPTY = new DriftWindowData(Map.of(), List.of(), List.of());

    public DriftWindowData {
        inputData = inputData == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(inputData));
        outputData = outputData == null ? List.of() : List.copyOf(outputData);
        biasData = biasData == null ? List.of() : List.copyOf(biasData);
    }

    public static DriftWindowData empty() {
        return EMPTY;
    }

    public static DriftWindowData of(Map<String, List<Double>> inputData, List<Double> outputData) {
        return new DriftWindowData(inputData, outputData, List.of());
    }
}
