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

import java.util.List;
import java.util.Map;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.signal.Signal;

/**
 * Runs the detectors one after the other on the calling thread.
 */
public class SequentialDetectorExecutor extends AbstractDetectorExecutor {

    public SequentialDetectorExecutor(List<Detector> detectors) {
        super(detectors);
    }

    @Override
    public Map<DetectionMethod, List<Candidate>> detectAll(Signal signal) {
        Map<DetectionMethod, List<Candidate>> results = newResultMap();
        detectors.forEach(detector -> results.put(detector.getMethod(), runDetector(detector, signal)));
        return results;
    }
}
