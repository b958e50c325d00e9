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
 * A failure scheduled at a given simulation time against one or several targets.
 * A negative duration means the failure is permanent.
 */
public class FailureEvent {

    public static final double PERMANENT = -1.0;

    private final String id;

    private String name;

    private String description = "";

    private final FailureEventType type;

    private FailureSeverity severity = FailureSeverity.MAJOR;

    private double triggerTime = 0.0;

    private double duration = PERMANENT;

    private double recoveryTime = -1.0;

    private FailureTargetType targetType;

    private String targetId = "";

    private final List<String> targetIds = new ArrayList<>();

    private int targetInterface = -1;

    private FailureParameters parameters = new FailureParameters();

    private FailureEventState state = FailureEventState.SCHEDULED;

    private double actualTriggerTime = 0.0;

    private double actualRecoveryTime = 0.0;

    private String errorMessage = "";

    private final List<String> causesEvents = new ArrayList<>();

    private String causedByEvent = "";

    private final List<String> dependsOnEvents = new ArrayList<>();

    private double probability = 1.0;

    private final List<String> tags = new ArrayList<>();

    public FailureEvent(String id, FailureEventType type) {
        this.id = Objects.requireNonNull(id);
        this.type = Objects.requireNonNull(type);
        this.name = type.name().toLowerCase(Locale.ROOT) + "_" + id;
        this.targetType = type.getDefaultTargetType();
    }

    public FailureEvent copy() {
        FailureEvent copy = new FailureEvent(id, type);
        copy.name = name;
        copy.description = description;
        copy.severity = severity;
        copy.triggerTime = triggerTime;
        copy.duration = duration;
        copy.recoveryTime = recoveryTime;
        copy.targetType = targetType;
        copy.targetId = targetId;
        copy.targetIds.addAll(targetIds);
        copy.targetInterface = targetInterface;
        copy.parameters = parameters.copy();
        copy.state = state;
        copy.actualTriggerTime = actualTriggerTime;
        copy.actualRecoveryTime = actualRecoveryTime;
        copy.errorMessage = errorMessage;
        copy.causesEvents.addAll(causesEvents);
        copy.causedByEvent = causedByEvent;
        copy.dependsOnEvents.addAll(dependsOnEvents);
        copy.probability = probability;
        copy.tags.addAll(tags);
        return copy;
    }

    public boolean isActive() {
        return state == FailureEventState.ACTIVE;
    }

    public boolean isScheduled() {
        return state == FailureEventState.SCHEDULED;
    }

    public boolean isCompleted() {
        return state == FailureEventState.RECOVERED || state == FailureEventState.CANCELLED;
    }

    public boolean hasDuration() {
        return duration > 0 || recoveryTime > 0;
    }

    /**
     * @return the time the failure ends, or a negative value for a permanent failure
     */
    public double getEffectiveRecoveryTime() {
        if (recoveryTime > 0) {
            return recoveryTime;
        } else if (duration > 0) {
            return triggerTime + duration;
        }
        return -1.0;
    }

    public boolean isCascadingRoot() {
        return !causesEvents.isEmpty() && causedByEvent.isEmpty();
    }

    public boolean isCascadingEffect() {
        return !causedByEvent.isEmpty();
    }

    public Set<String> getAllTargets() {
        Set<String> targets = new LinkedHashSet<>();
        if (!targetId.isEmpty()) {
            targets.add(targetId);
        }
        targets.addAll(targetIds);
        return targets;
    }

    public boolean canTriggerAt(double time) {
        return state == FailureEventState.SCHEDULED && triggerTime <= time;
    }

    public boolean shouldRecoverAt(double time) {
        if (state != FailureEventState.ACTIVE) {
            return false;
        }
        double recovery = getEffectiveRecoveryTime();
        return recovery > 0 && recovery <= time;
    }

    void resetState() {
        state = FailureEventState.SCHEDULED;
        actualTriggerTime = 0.0;
        actualRecoveryTime = 0.0;
        errorMessage = "";
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public FailureEvent setName(String name) {
        this.name = Objects.requireNonNull(name);
        return this;
    }

    public String getDescription() {
        return description;
    }

    public FailureEvent setDescription(String description) {
        this.description = Objects.requireNonNull(description);
        return this;
    }

    public FailureEventType getType() {
        return type;
    }

    public FailureSeverity getSeverity() {
        return severity;
    }

    public FailureEvent setSeverity(FailureSeverity severity) {
        this.severity = Objects.requireNonNull(severity);
        return this;
    }

    public double getTriggerTime() {
        return triggerTime;
    }

    public FailureEvent setTriggerTime(double triggerTime) {
        this.triggerTime = triggerTime;
        return this;
    }

    public double getDuration() {
        return duration;
    }

    public FailureEvent setDuration(double duration) {
        this.duration = duration;
        return this;
    }

    public double getRecoveryTime() {
        return recoveryTime;
    }

    public FailureEvent setRecoveryTime(double recoveryTime) {
        this.recoveryTime = recoveryTime;
        return this;
    }

    public FailureTargetType getTargetType() {
        return targetType;
    }

    public FailureEvent setTargetType(FailureTargetType targetType) {
        this.targetType = Objects.requireNonNull(targetType);
        return this;
    }

    public String getTargetId() {
        return targetId;
    }

    public FailureEvent setTargetId(String targetId) {
        this.targetId = Objects.requireNonNull(targetId);
        return this;
    }

    public List<String> getTargetIds() {
        return Collections.unmodifiableList(targetIds);
    }

    public FailureEvent setTargetIds(List<String> targetIds) {
        this.targetIds.clear();
        this.targetIds.addAll(targetIds);
        return this;
    }

    public int getTargetInterface() {
        return targetInterface;
    }

    public FailureEvent setTargetInterface(int targetInterface) {
        this.targetInterface = targetInterface;
        return this;
    }

    public FailureParameters getParameters() {
        return parameters;
    }

    public FailureEvent setParameters(FailureParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters);
        return this;
    }

    public FailureEventState getState() {
        return state;
    }

    public FailureEvent setState(FailureEventState state) {
        this.state = Objects.requireNonNull(state);
        return this;
    }

    public double getActualTriggerTime() {
        return actualTriggerTime;
    }

    public FailureEvent setActualTriggerTime(double actualTriggerTime) {
        this.actualTriggerTime = actualTriggerTime;
        return this;
    }

    public double getActualRecoveryTime() {
        return actualRecoveryTime;
    }

    public FailureEvent setActualRecoveryTime(double actualRecoveryTime) {
        this.actualRecoveryTime = actualRecoveryTime;
        return this;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public FailureEvent setErrorMessage(String errorMessage) {
        this.errorMessage = Objects.requireNonNull(errorMessage);
        return this;
    }

    public List<String> getCausesEvents() {
        return Collections.unmodifiableList(causesEvents);
    }

    public FailureEvent addCausedEvent(String eventId) {
        causesEvents.add(Objects.requireNonNull(eventId));
        return this;
    }

    public String getCausedByEvent() {
        return causedByEvent;
    }

    public FailureEvent setCausedByEvent(String causedByEvent) {
        this.causedByEvent = Objects.requireNonNull(causedByEvent);
        return this;
    }

    public List<String> getDependsOnEvents() {
        return Collections.unmodifiableList(dependsOnEvents);
    }

    public FailureEvent addDependsOnEvent(String eventId) {
        dependsOnEvents.add(Objects.requireNonNull(eventId));
        return this;
    }

    public double getProbability() {
        return probability;
    }

    public FailureEvent setProbability(double probability) {
        if (probability < 0 || probability > 1) {
            throw new IllegalArgumentException("Probability must be in [0, 1]: " + probability);
        }
        this.probability = probability;
        return this;
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public FailureEvent addTag(String tag) {
        tags.add(Objects.requireNonNull(tag));
        return this;
    }

    @Override
    public String toString() {
        return id + " " + type + " @" + triggerTime + "s";
    }
}
