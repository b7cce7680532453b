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

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.signal.Signal;

/**
 * A stateless anomaly detector. Implementations must be pure functions of the
 * signal so that a bank of detectors can run concurrently over one instance.
 */
public interface Detector {

    /**
     * @return the method this detector implements
     */
    DetectionMethod getMethod();

    /**
     * @return the shortest signal on which this detector can flag anything
     */
    int getMinimumLength();

    /**
     * Flags anomalous positions. A signal that is too short or numerically
     * degenerate yields an empty list, never an exception.
     *
     * @param signal the signal to inspect
     * @return at most one candidate per index, in ascending index order
     */
    List<Candidate> detect(Signal signal);
}
