/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.failure;

import java.util.*;

/**
 * Rule generating follow-up failures when an event of a given type hits a matching target.
 */
public class CascadingFailureRule {

    private final String id;

    private String name = "";

    private final Set<FailureEventType> triggerEventTypes = EnumSet.noneOf(FailureEventType.class);

    private final List<String> triggerTargetPatterns = new ArrayList<>();

    private FailureEventType generatedEventType = FailureEventType.LINK_DOWN;

    private double delay = 0.0;

    private double delayRandom = 0.0;

    private double probability = 1.0;

    private String targetSelection = "adjacent";

    private int targetCount = 1;

    private FailureParameters generatedParameters = new FailureParameters();

    private double generatedDuration = FailureEvent.PERMANENT;

    private boolean enabled = true;

    public CascadingFailureRule(String id) {
        this.id = Objects.requireNonNull(id);
    }

    public CascadingFailureRule copy() {
        CascadingFailureRule copy = new CascadingFailureRule(id);
        copy.name = name;
        copy.triggerEventTypes.addAll(triggerEventTypes);
        copy.triggerTargetPatterns.addAll(triggerTargetPatterns);
        copy.generatedEventType = generatedEventType;
        copy.delay = delay;
        copy.delayRandom = delayRandom;
        copy.probability = probability;
        copy.targetSelection = targetSelection;
        copy.targetCount = targetCount;
        copy.generatedParameters = generatedParameters.copy();
        copy.generatedDuration = generatedDuration;
        copy.enabled = enabled;
        return copy;
    }

    /**
     * A rule matches an event of one of its trigger types whose targets contain one of the patterns,
     * or any target when no pattern is given.
     */
    public boolean matches(FailureEvent event) {
        if (!enabled || !triggerEventTypes.contains(event.getType())) {
            return false;
        }
        if (triggerTargetPatterns.isEmpty()) {
            return true;
        }
        return event.getAllTargets().stream()
                .anyMatch(target -> triggerTargetPatterns.stream().anyMatch(target::contains));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public CascadingFailureRule setName(String name) {
        this.name = Objects.requireNonNull(name);
        return this;
    }

    public Set<FailureEventType> getTriggerEventTypes() {
        return Collections.unmodifiableSet(triggerEventTypes);
    }

    public CascadingFailureRule addTriggerEventType(FailureEventType type) {
        triggerEventTypes.add(Objects.requireNonNull(type));
        return this;
    }

    public List<String> getTriggerTargetPatterns() {
        return Collections.unmodifiableList(triggerTargetPatterns);
    }

    public CascadingFailureRule addTriggerTargetPattern(String pattern) {
        triggerTargetPatterns.add(Objects.requireNonNull(pattern));
        return this;
    }

    public FailureEventType getGeneratedEventType() {
        return generatedEventType;
    }

    public CascadingFailureRule setGeneratedEventType(FailureEventType generatedEventType) {
        this.generatedEventType = Objects.requireNonNull(generatedEventType);
        return this;
    }

    public double getDelay() {
        return delay;
    }

    public CascadingFailureRule setDelay(double delay) {
        this.delay = delay;
        return this;
    }

    public double getDelayRandom() {
        return delayRandom;
    }

    public CascadingFailureRule setDelayRandom(double delayRandom) {
        this.delayRandom = delayRandom;
        return this;
    }

    public double getProbability() {
        return probability;
    }

    public CascadingFailureRule setProbability(double probability) {
        this.probability = probability;
        return this;
    }

    public String getTargetSelection() {
        return targetSelection;
    }

    public CascadingFailureRule setTargetSelection(String targetSelection) {
        this.targetSelection = Objects.requireNonNull(targetSelection);
        return this;
    }

    public int getTargetCount() {
        return targetCount;
    }

    public CascadingFailureRule setTargetCount(int targetCount) {
        this.targetCount = targetCount;
        return this;
    }

    public FailureParameters getGeneratedParameters() {
        return generatedParameters;
    }

    public CascadingFailureRule setGeneratedParameters(FailureParameters generatedParameters) {
        this.generatedParameters = Objects.requireNonNull(generatedParameters);
        return this;
    }

    public double getGeneratedDuration() {
        return generatedDuration;
    }

    public CascadingFailureRule setGeneratedDuration(double generatedDuration) {
        this.generatedDuration = generatedDuration;
        return this;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public CascadingFailureRule setEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }
}
