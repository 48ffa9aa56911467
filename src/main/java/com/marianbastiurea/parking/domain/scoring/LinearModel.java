package com.marianbastiurea.parking.domain.scoring;

import com.marianbastiurea.parking.domain.model.FeatureVector;
import com.marianbastiurea.parking.domain.model.FeatureVector.Feature;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/** {@code intercept + Σ weight(f) * f}; features without a weight contribute nothing. */
public final class LinearModel {

    private final double intercept;
    private final Map<Feature, Double> weights;

    public LinearModel(double intercept, Map<Feature, Double> weights) {
        this.intercept = intercept;
        this.weights = new EnumMap<>(Feature.class);
        Objects.requireNonNull(weights, "weights").forEach((f, w) -> this.weights.put(f, w == null ? 0.0 : w));
    }

    public static LinearModel constant(double value) {
        return new LinearModel(value, Map.of());
    }

    public double predict(FeatureVector features) {
        double y = intercept;
        for (Map.Entry<Feature, Double> e : weights.entrySet()) {
            y += e.getValue() * features.get(e.getKey());
        }
        return y;
    }

    /** Prediction rounded to the nearest index and clamped into {@code [0, size)}. */
    public int predictIndex(FeatureVector features, int size) {
        long idx = Math.round(predict(features));
        return (int) Math.max(0, Math.min(size - 1, idx));
    }

    @Override
    public String toString() {
        return "LinearModel{intercept=" + intercept + ", weights=" + weights + "}";
    }
}
