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

import static com.amazon.anomalyensemble.CommonUtils.checkArgument;
import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.signal.Signal;

/**
 * The enabled detectors of an ensemble together with the executor that runs
 * them. Detectors are independent of each other, so the bank may run them in
 * parallel with no ordering requirement. A parallel bank owns a thread pool
 * that {@link #close()} releases.
 */
public class DetectorBank implements AutoCloseable {

    private final AbstractDetectorExecutor executor;

    public DetectorBank(EnsembleConfig config) {
        this(createDetectors(config), config.isParallelExecutionEnabled(), config.getThreadPoolSize());
    }

    public DetectorBank(List<Detector> detectors, boolean parallelExecutionEnabled, int threadPoolSize) {
        checkNotNull(detectors, "detectors must not be null");
        Set<DetectionMethod> seen = EnumSet.noneOf(DetectionMethod.class);
        for (Detector detector : detectors) {
            checkArgument(seen.add(detector.getMethod()), "duplicate detector for " + detector.getMethod());
        }
        List<Detector> copy = new ArrayList<>(detectors);
        if (parallelExecutionEnabled && copy.size() > 1) {
            executor = new ParallelDetectorExecutor(copy, threadPoolSize);
        } else {
            executor = new SequentialDetectorExecutor(copy);
        }
    }

    /**
     * Creates the detectors of the enabled methods, in canonical order.
     *
     * @param config the ensemble configuration
     * @return one detector per enabled method
     */
    public static List<Detector> createDetectors(EnsembleConfig config) {
        List<Detector> detectors = new ArrayList<>();
        for (DetectionMethod method : config.getEnabledMethods()) {
            detectors.add(createDetector(method, config));
        }
        return detectors;
    }

    public static Detector createDetector(DetectionMethod method, EnsembleConfig config) {
        switch (method) {
        case STATISTICAL:
            return new StatisticalDetector(config);
        case PATTERN_BASED:
            return new PatternDetector(config);
        case FREQUENCY:
            return new FrequencyDetector(config);
        case LEARNED_DENSITY:
            return new DensityDetector(config);
        case PHYSIOLOGICAL:
            return new PhysiologicalDetector(config);
        case TEMPORAL:
            return new TemporalDetector(config);
        default:
            throw new IllegalArgumentException("unsupported method " + method);
        }
    }

    /**
     * @param signal the signal to inspect
     * @return candidates by method; every enabled method has an entry, possibly
     *         empty
     */
    public Map<DetectionMethod, List<Candidate>> detect(Signal signal) {
        checkNotNull(signal, "signal must not be null");
        return executor.detectAll(signal);
    }

    @Override
    public void close() {
        executor.close();
    }

    public List<Detector> getDetectors() {
        return executor.getDetectors();
    }

    public Set<DetectionMethod> getMethods() {
        Set<DetectionMethod> methods = EnumSet.noneOf(DetectionMethod.class);
        executor.getDetectors().forEach(detector -> methods.add(detector.getMethod()));
        return methods;
    }

    public boolean isParallel() {
        return executor instanceof ParallelDetectorExecutor;
    }
}
