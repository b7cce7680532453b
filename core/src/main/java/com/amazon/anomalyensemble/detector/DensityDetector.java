/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalyensemble.detector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.stream.IntStream;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.math3.ml.distance.EuclideanDistance;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.signal.Signal;
import com.amazon.anomalyensemble.statistics.NumericDegeneracyException;
import com.amazon.anomalyensemble.statistics.Statistics;

/**
 * Density outlier detector over a fixed per-position feature vector: the value,
 * the first and second differences, the mean and deviation of the trailing five
 * points, the deviation from the trailing ten-point mean and the slope of the
 * centered five points. Features are standardized and scored by the local
 * outlier factor over the k nearest neighbors; the top contamination share of
 * points whose factor exceeds the minimum is flagged with a raw score of 1.
 *
 * <p>
 * Cost is quadratic in the signal length because every pairwise distance is
 * computed.
 */
@Slf4j
public class DensityDetector extends AbstractDetector {

    public static final double RAW_SCORE = 1.0;

    /** Keeps the local reachability density finite for duplicated points. */
    public static final double REACHABILITY_EPSILON = 1e-10;

    static final int FEATURE_COUNT = 7;

    // first and last positions without a full feature neighborhood
    static final int MARGIN = 2;

    private final EuclideanDistance distance = new EuclideanDistance();

    public DensityDetector(EnsembleConfig config) {
        super(config);
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.LEARNED_DENSITY;
    }

    @Override
    public int getMinimumLength() {
        return config.getMinLengthForDensity();
    }

    @Override
    protected void score(Signal signal, SortedMap<Integer, Double> scores) {
        double[][] features = standardize(features(signal));
        double[] factors = localOutlierFactors(features, Math.min(config.getDensityNeighbors(), features.length - 1));

        List<Integer> outliers = new ArrayList<>();
        for (int i = 0; i < factors.length; i++) {
            if (factors[i] > config.getMinOutlierFactor()) {
                outliers.add(i);
            }
        }
        outliers.sort(Comparator.<Integer>comparingDouble(i -> -factors[i]).thenComparingInt(i -> i));
        int limit = Math.max(1, (int) Math.round(config.getContamination() * features.length));
        for (int i = 0; i < Math.min(limit, outliers.size()); i++) {
            flag(scores, outliers.get(i) + MARGIN, RAW_SCORE);
        }
    }

    /**
     * @return one row per position in [2, n - 2)
     */
    double[][] features(Signal signal) {
        double[] x = signal.getValues();
        double[] minutes = signal.getMinuteOffsets(config.getNominalIntervalMinutes());
        int n = x.length;
        double[][] rows = new double[n - 2 * MARGIN][];
        for (int i = MARGIN; i < n - MARGIN; i++) {
            int shortStart = Math.max(0, i - 4);
            int longStart = Math.max(0, i - 9);
            rows[i - MARGIN] = new double[] { x[i], x[i] - x[i - 1], x[i - 1] - 2 * x[i] + x[i + 1],
                    Statistics.mean(x, shortStart, i + 1), Statistics.standardDeviation(x, shortStart, i + 1),
                    x[i] - Statistics.mean(x, longStart, i + 1), Statistics.slope(minutes, x, i - 2, i + 3) };
        }
        return rows;
    }

    /**
     * Scales every column to zero mean and unit deviation; constant columns
     * become zero.
     *
     * @throws NumericDegeneracyException if every row is identical afterwards
     */
    static double[][] standardize(double[][] rows) {
        int m = rows.length;
        double[][] result = new double[m][FEATURE_COUNT];
        boolean varying = false;
        for (int f = 0; f < FEATURE_COUNT; f++) {
            double[] column = column(rows, f);
            double mean = Statistics.mean(column);
            double std = Statistics.standardDeviation(column);
            if (std > 0) {
                varying = true;
                for (int i = 0; i < m; i++) {
                    result[i][f] = (column[i] - mean) / std;
                }
            }
        }
        if (!varying) {
            throw new NumericDegeneracyException("all feature vectors coincide");
        }
        return result;
    }

    double[] localOutlierFactors(double[][] points, int k) {
        int m = points.length;
        double[][] distances = new double[m][m];
        for (int i = 0; i < m; i++) {
            for (int j = i + 1; j < m; j++) {
                distances[i][j] = distance.compute(points[i], points[j]);
                distances[j][i] = distances[i][j];
            }
        }

        int[][] neighbors = new int[m][];
        double[] kDistance = new double[m];
        for (int i = 0; i < m; i++) {
            final double[] row = distances[i];
            final int self = i;
            neighbors[i] = IntStream.range(0, m).filter(j -> j != self).boxed()
                    .sorted(Comparator.<Integer>comparingDouble(j -> row[j]).thenComparingInt(j -> j)).limit(k)
                    .mapToInt(Integer::intValue).toArray();
            kDistance[i] = row[neighbors[i][k - 1]];
        }

        double[] density = new double[m];
        for (int i = 0; i < m; i++) {
            double sum = 0;
            for (int j : neighbors[i]) {
                sum += Math.max(kDistance[j], distances[i][j]);
            }
            density[i] = 1.0 / (sum / k + REACHABILITY_EPSILON);
        }

        double[] factors = new double[m];
        for (int i = 0; i < m; i++) {
            double sum = 0;
            for (int j : neighbors[i]) {
                sum += density[j];
            }
            factors[i] = sum / k / density[i];
        }
        log.debug("local outlier factors computed for {} points with k = {}", m, k);
        return factors;
    }

    static double[] column(double[][] rows, int feature) {
        return Arrays.stream(rows).mapToDouble(row -> row[feature]).toArray();
    }
}
