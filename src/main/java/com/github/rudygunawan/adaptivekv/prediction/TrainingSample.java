package com.github.rudygunawan.adaptivekv.prediction;

import java.util.Arrays;

/**
 * One labelled observation: the features of a key at lookup time and whether the lookup hit.
 */
public final class TrainingSample {
    private final double[] features;
    private final boolean hit;

    public TrainingSample(double[] features, boolean hit) {
        if (features.length != LogisticModel.FEATURE_COUNT) {
            throw new IllegalArgumentException("expected " + LogisticModel.FEATURE_COUNT
                    + " features, got " + features.length);
        }
        this.features = features.clone();
        this.hit = hit;
    }

    double[] features() {
        return features;
    }

    public boolean isHit() {
        return hit;
    }

    @Override
    public String toString() {
        return "TrainingSample{features=" + Arrays.toString(features) + ", hit=" + hit + '}';
    }
}
