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

package com.amazon.anomalyensemble.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.ZoneId;
import java.util.EnumSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.anomalyensemble.config.ConfidenceTier;
import com.amazon.anomalyensemble.config.DetectionMethod;
import com.amazon.anomalyensemble.config.EnsembleConfig;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testNew() {
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getHeaderRow());
        assertEquals(1.0, parser.getUnitFactor());
        assertEquals(ZoneId.of("UTC"), parser.getZone());
        assertTrue(parser.getTimeOfDay());
        assertEquals(EnsembleConfig.DEFAULT_SCORE_FLOOR, parser.getScoreFloor());
        assertEquals(ConfidenceTier.LOW, parser.getMinimumTier());
        assertFalse(parser.getCalibrateWeights());
        assertEquals(EnumSet.allOf(DetectionMethod.class), parser.getMethods());
        assertTrue(parser.getParallelExecution());
        assertEquals(EnsembleConfig.DEFAULT_THREAD_POOL_SIZE, parser.getThreadPoolSize());
    }

    @Test
    public void testParse() {
        parser.parse("--delimiter", "\t", "--header-row", "true", "--unit", "mmol", "--zone", "Europe/Berlin",
                "--time-of-day", "false", "--score-floor", "0.6", "--minimum-tier", "medium", "--calibrate-weights",
                "true", "--methods", "statistical, physiological", "--parallel", "false", "--thread-pool-size", "2");

        assertEquals("\t", parser.getDelimiter());
        assertTrue(parser.getHeaderRow());
        assertEquals(ArgumentParser.MMOL_TO_MGDL, parser.getUnitFactor());
        assertEquals(ZoneId.of("Europe/Berlin"), parser.getZone());
        assertFalse(parser.getTimeOfDay());
        assertEquals(0.6, parser.getScoreFloor());
        assertEquals(ConfidenceTier.MEDIUM, parser.getMinimumTier());
        assertTrue(parser.getCalibrateWeights());
        assertEquals(EnumSet.of(DetectionMethod.STATISTICAL, DetectionMethod.PHYSIOLOGICAL), parser.getMethods());
        assertFalse(parser.getParallelExecution());
        assertEquals(2, parser.getThreadPoolSize());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-d", ";", "-u", "MMOL", "-z", "Asia/Tokyo", "-f", "0.5", "-m", "high", "-t", "3");

        assertEquals(";", parser.getDelimiter());
        assertEquals(18.0, parser.getUnitFactor());
        assertEquals(ZoneId.of("Asia/Tokyo"), parser.getZone());
        assertEquals(0.5, parser.getScoreFloor());
        assertEquals(ConfidenceTier.HIGH, parser.getMinimumTier());
        assertEquals(3, parser.getThreadPoolSize());
    }

    @Test
    public void testToConfig() {
        parser.parse("--score-floor", "0.7", "--methods", "temporal,frequency", "--calibrate-weights", "true",
                "--parallel", "false", "-t", "4");
        EnsembleConfig config = parser.toConfig();

        assertEquals(0.7, config.getScoreFloor());
        assertEquals(EnumSet.of(DetectionMethod.FREQUENCY, DetectionMethod.TEMPORAL), config.getEnabledMethods());
        assertTrue(config.isWeightCalibrationEnabled());
        assertFalse(config.isParallelExecutionEnabled());
        assertEquals(4, config.getThreadPoolSize());
        config.validate();
    }

    @Test
    public void testParseMethods() {
        assertEquals(EnumSet.allOf(DetectionMethod.class), ArgumentParser.parseMethods(" ALL "));
        assertEquals(EnumSet.of(DetectionMethod.LEARNED_DENSITY), ArgumentParser.parseMethods("Learned_Density"));
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseMethods("wavelet"));
    }
}
