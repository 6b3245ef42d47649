package com.polyspike.hft.engine.signal;

import lombok.experimental.UtilityClass;

import java.util.List;

@UtilityClass
class Stats {

    static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    static double populationStdev(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mu = mean(values);
        double sq = 0.0;
        for (double v : values) {
            sq += (v - mu) * (v - mu);
        }
        return Math.sqrt(sq / values.size());
    }
}
