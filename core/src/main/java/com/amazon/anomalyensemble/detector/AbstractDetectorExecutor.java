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

import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.signal.MalformedSignalException;
import com.amazon.anomalyensemble.signal.Signal;

/**
 * Runs a fixed list of detectors over one signal and joins their results. A
 * detector that fails unexpectedly contributes an empty candidate list so that
 * one faulty method never sinks the whole run; only a malformed signal
 * propagates.
 */
@Slf4j
public abstract class AbstractDetectorExecutor implements AutoCloseable {

    protected final List<Detector> detectors;

    protected AbstractDetectorExecutor(List<Detector> detectors) {
        this.detectors = Collections.unmodifiableList(checkNotNull(detectors, "detectors must not be null"));
    }

    /**
     * @param signal the signal to inspect
     * @return the candidates of every detector, keyed by method in canonical
     *         order
     */
    public abstract Map<DetectionMethod, List<Candidate>> detectAll(Signal signal);

    protected static List<Candidate> runDetector(Detector detector, Signal signal) {
        try {
            return detector.detect(signal);
        } catch (MalformedSignalException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("{} detector failed, its contribution is dropped", detector.getMethod().getKey(), e);
            return Collections.emptyList();
        }
    }

    protected static Map<DetectionMethod, List<Candidate>> newResultMap() {
        return new EnumMap<>(DetectionMethod.class);
    }

    /**
     * Releases the threads of the executor, if any.
     */
    @Override
    public void close() {
    }

    public List<Detector> getDetectors() {
        return detectors;
    }
}
