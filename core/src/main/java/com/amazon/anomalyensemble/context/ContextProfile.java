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

package com.amazon.anomalyensemble.context;

import static com.amazon.anomalyensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * An ordered, swappable table of time-of-day rules. The first rule matching an
 * hour and value decides the multiplier; with no match the multiplier is 1.
 */
@EqualsAndHashCode
@ToString
public class ContextProfile {

    private final List<TimeWindowRule> rules;

    public ContextProfile(List<TimeWindowRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(checkNotNull(rules, "rules must not be null")));
    }

    /**
     * @return a profile without rules
     */
    public static ContextProfile none() {
        return new ContextProfile(Collections.emptyList());
    }

    /**
     * The daily glucose rhythm: elevation after lunch and dinner is expected,
     * the night is expected to be stable in the normal range, and lows in the
     * early morning are more alarming than usual.
     *
     * @return the default glucose profile
     */
    public static ContextProfile glucoseDefaults() {
        List<TimeWindowRule> rules = new ArrayList<>();
        rules.add(new TimeWindowRule("post-lunch elevation", 12, 14, 150, 220, 0.6));
        rules.add(new TimeWindowRule("post-dinner elevation", 18, 20, 150, 200, 0.7));
        rules.add(new TimeWindowRule("nocturnal stability", 23, 6, 80, 120, 0.5));
        rules.add(new TimeWindowRule("early morning low", 3, 6, Double.NEGATIVE_INFINITY, 80, 1.4));
        return new ContextProfile(rules);
    }

    /**
     * @return a copy of this profile with the rule appended
     */
    public ContextProfile withRule(TimeWindowRule rule) {
        List<TimeWindowRule> copy = new ArrayList<>(rules);
        copy.add(checkNotNull(rule, "rule must not be null"));
        return new ContextProfile(copy);
    }

    public List<TimeWindowRule> getRules() {
        return rules;
    }

    public Optional<TimeWindowRule> match(int hour, double value) {
        return rules.stream().filter(rule -> rule.matches(hour, value)).findFirst();
    }

    public double multiplier(int hour, double value) {
        return match(hour, value).map(TimeWindowRule::getMultiplier).orElse(1.0);
    }
}
