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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.ArgumentsProvider;
import org.junit.jupiter.params.provider.ArgumentsSource;

import com.amazon.anomalyensemble.TestUtils;
import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;
import com.amazon.anomalyensemble.returntypes.Candidate;
import com.amazon.anomalyensemble.signal.MalformedSignalException;
import com.amazon.anomalyensemble.signal.Signal;
import com.amazon.anomalyensemble.testutils.GlucoseDataSets;

public class DetectorBankTest {

    private static final int THREAD_POOL_SIZE = 2;

    private static final Signal SIGNAL = Signal.of(100, 101, 102);

    private static Detector mockDetector(DetectionMethod method, List<Candidate> candidates) {
        Detector detector = mock(Detector.class);
        when(detector.getMethod()).thenReturn(method);
        when(detector.detect(any())).thenReturn(candidates);
        return detector;
    }

    private static class ExecutionModeProvider implements ArgumentsProvider {
        @Override
        public Stream<? extends Arguments> provideArguments(ExtensionContext context) {
            return Stream.of(false, true).map(Arguments::of);
        }
    }

    @ParameterizedTest
    @ArgumentsSource(ExecutionModeProvider.class)
    public void testEveryDetectorRunsOnce(boolean parallel) {
        List<Detector> detectors = new ArrayList<>();
        for (DetectionMethod method : DetectionMethod.values()) {
            detectors.add(mockDetector(method, TestUtils.candidates(method, method.ordinal())));
        }
        DetectorBank bank = new DetectorBank(detectors, parallel, THREAD_POOL_SIZE);
        assertEquals(parallel, bank.isParallel());

        Map<DetectionMethod, List<Candidate>> result = bank.detect(SIGNAL);

        assertEquals(Arrays.asList(DetectionMethod.values()), new ArrayList<>(result.keySet()));
        for (Detector detector : detectors) {
            verify(detector, times(1)).detect(SIGNAL);
            DetectionMethod method = detector.getMethod();
            assertEquals(TestUtils.candidates(method, method.ordinal()), result.get(method));
        }
    }

    @ParameterizedTest
    @ArgumentsSource(ExecutionModeProvider.class)
    public void testFailingDetectorContributesNothing(boolean parallel) {
        Detector failing = mockDetector(DetectionMethod.FREQUENCY, null);
        when(failing.detect(any())).thenThrow(new IllegalStateException("broken"));
        Detector healthy = mockDetector(DetectionMethod.STATISTICAL,
                TestUtils.candidates(DetectionMethod.STATISTICAL, 1));

        Map<DetectionMethod, List<Candidate>> result = new DetectorBank(Arrays.asList(failing, healthy), parallel,
                THREAD_POOL_SIZE).detect(SIGNAL);

        assertTrue(result.get(DetectionMethod.FREQUENCY).isEmpty());
        assertEquals(1, result.get(DetectionMethod.STATISTICAL).size());
    }

    @ParameterizedTest
    @ArgumentsSource(ExecutionModeProvider.class)
    public void testMalformedSignalPropagates(boolean parallel) {
        Detector strict = mockDetector(DetectionMethod.TEMPORAL, null);
        when(strict.detect(any())).thenThrow(new MalformedSignalException("bad signal"));
        Detector healthy = mockDetector(DetectionMethod.STATISTICAL, Collections.emptyList());

        DetectorBank bank = new DetectorBank(Arrays.asList(strict, healthy), parallel, THREAD_POOL_SIZE);
        assertThrows(MalformedSignalException.class, () -> bank.detect(SIGNAL));
    }

    @Test
    public void testDuplicateMethodsAreRejected() {
        List<Detector> detectors = Arrays.asList(mockDetector(DetectionMethod.STATISTICAL, Collections.emptyList()),
                mockDetector(DetectionMethod.STATISTICAL, Collections.emptyList()));
        assertThrows(IllegalArgumentException.class, () -> new DetectorBank(detectors, false, 1));
    }

    @Test
    public void testSingleDetectorRunsSequentially() {
        DetectorBank bank = new DetectorBank(
                Collections.singletonList(mockDetector(DetectionMethod.STATISTICAL, Collections.emptyList())), true,
                THREAD_POOL_SIZE);
        assertFalse(bank.isParallel());
    }

    @Test
    public void testClosedParallelExecutorRejectsWork() {
        List<Detector> detectors = Arrays.asList(mockDetector(DetectionMethod.STATISTICAL, Collections.emptyList()),
                mockDetector(DetectionMethod.TEMPORAL, Collections.emptyList()));
        ParallelDetectorExecutor executor = new ParallelDetectorExecutor(detectors, THREAD_POOL_SIZE);
        assertEquals(2, executor.detectAll(SIGNAL).size());

        executor.close();
        assertTrue(executor.isClosed());
        assertThrows(RejectedExecutionException.class, () -> executor.detectAll(SIGNAL));
    }

    @Test
    public void testClosingSequentialBankKeepsItUsable() {
        DetectorBank bank = new DetectorBank(
                Collections.singletonList(mockDetector(DetectionMethod.STATISTICAL, Collections.emptyList())), false,
                THREAD_POOL_SIZE);
        bank.close();
        assertEquals(EnumSet.of(DetectionMethod.STATISTICAL), bank.detect(SIGNAL).keySet());
    }

    @Test
    public void testCreateDetectorsFollowsEnabledMethods() {
        EnsembleConfig config = EnsembleConfig.builder()
                .enabledMethods(EnumSet.of(DetectionMethod.TEMPORAL, DetectionMethod.STATISTICAL)).build();
        DetectorBank bank = new DetectorBank(config);

        assertEquals(EnumSet.of(DetectionMethod.STATISTICAL, DetectionMethod.TEMPORAL), bank.getMethods());
        assertTrue(bank.getDetectors().get(0) instanceof StatisticalDetector);
        assertTrue(bank.getDetectors().get(1) instanceof TemporalDetector);
        assertEquals(EnumSet.of(DetectionMethod.STATISTICAL, DetectionMethod.TEMPORAL),
                bank.detect(SIGNAL).keySet());
    }

    @Test
    public void testParallelAndSequentialAgree() {
        Signal signal = TestUtils.timestamped(GlucoseDataSets.flatRunAndSpike(42), 5);
        EnsembleConfig sequential = EnsembleConfig.builder().parallelExecutionEnabled(false).build();
        EnsembleConfig parallel = EnsembleConfig.builder().parallelExecutionEnabled(true).threadPoolSize(3).build();

        assertEquals(new DetectorBank(sequential).detect(signal), new DetectorBank(parallel).detect(signal));
    }
}
