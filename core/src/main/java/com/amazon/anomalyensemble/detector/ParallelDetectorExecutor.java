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
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;

import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.signal.Signal;

/**
 * Runs the detectors as independent tasks on a private thread pool and joins
 * before returning. The pool lives until {@link #close()}; a closed executor
 * rejects further work.
 */
public class ParallelDetectorExecutor extends AbstractDetectorExecutor {

    private final ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelDetectorExecutor(List<Detector> detectors, int threadPoolSize) {
        super(detectors);
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public Map<DetectionMethod, List<Candidate>> detectAll(Signal signal) {
        Map<DetectionMethod, List<Candidate>> joined = submitAndJoin(() -> detectors.parallelStream()
                .collect(Collectors.toMap(Detector::getMethod, detector -> runDetector(detector, signal))));
        Map<DetectionMethod, List<Candidate>> results = newResultMap();
        results.putAll(joined);
        return results;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    /**
     * Shuts the pool down; tasks already submitted still complete.
     */
    @Override
    public void close() {
        forkJoinPool.shutdown();
    }

    public boolean isClosed() {
        return forkJoinPool.isShutdown();
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        return forkJoinPool.submit(callable).join();
    }
}
