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
 * Failure events ordered by trigger time, plus the rules generating cascading failures.
 * A scenario is pure data: nothing here advances a clock.
 */
public class FailureScenario {

    public static final double TIME_TOLERANCE = 0.001;

    private static final Comparator<FailureEvent> TRIGGER_ORDER = Comparator.comparingDouble(FailureEvent::getTriggerTime);

    private final String id;

    private String name = "Unnamed Scenario";

    private String description = "";

    private final List<FailureEvent> events = new ArrayList<>();

    private final List<CascadingFailureRule> cascadingRules = new ArrayList<>();

    private FailureCategory category = FailureCategory.EQUIPMENT;

    private FailureSeverity severity = FailureSeverity.MAJOR;

    private final List<String> tags = new ArrayList<>();

    private boolean enabled = true;

    private int repeatCount = 1;

    private int randomSeed = 0;

    private double timeOffset = 0.0;

    private double timeScale = 1.0;

    public FailureScenario(String id) {
        this.id = Objects.requireNonNull(id);
    }

    /**
     * Adds an event, keeping events sorted by trigger time. Events with the same trigger time keep insertion order.
     */
    public FailureScenario addEvent(FailureEvent event) {
        Objects.requireNonNull(event);
        events.add(event);
        events.sort(TRIGGER_ORDER);
        return this;
    }

    public Optional<FailureEvent> removeEvent(String eventId) {
        Optional<FailureEvent> event = getEvent(eventId);
        event.ifPresent(events::remove);
        return event;
    }

    public Optional<FailureEvent> getEvent(String eventId) {
        Objects.requireNonNull(eventId);
        return events.stream().filter(e -> e.getId().equals(eventId)).findFirst();
    }

    public List<FailureEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public int getEventCount() {
        return events.size();
    }

    public List<FailureEvent> getEventsAtTime(double time) {
        return events.stream().filter(e -> Math.abs(e.getTriggerTime() - time) < TIME_TOLERANCE).toList();
    }

    public List<FailureEvent> getEventsInRange(double start, double end) {
        return events.stream().filter(e -> e.getTriggerTime() >= start && e.getTriggerTime() <= end).toList();
    }

    /**
     * Events already triggered and not yet recovered at the given time, permanent ones included.
     */
    public List<FailureEvent> getActiveEventsAtTime(double time) {
        List<FailureEvent> active = new ArrayList<>();
        for (FailureEvent event : events) {
            if (event.getTriggerTime() <= time) {
                double recovery = event.getEffectiveRecoveryTime();
                if (recovery < 0 || recovery > time) {
                    active.add(event);
                }
            }
        }
        return active;
    }

    public List<FailureEvent> getEventsByType(FailureEventType type) {
        return events.stream().filter(e -> e.getType() == type).toList();
    }

    public List<FailureEvent> getEventsByTarget(String targetId) {
        return events.stream().filter(e -> e.getAllTargets().contains(targetId)).toList();
    }

    /**
     * Time the last event ends, a permanent event counting as ending at its trigger time.
     */
    public double getDuration() {
        double max = 0.0;
        for (FailureEvent event : events) {
            double end = event.getEffectiveRecoveryTime();
            if (end < 0) {
                end = event.getTriggerTime();
            }
            max = Math.max(max, end);
        }
        return max;
    }

    public Set<String> getUniqueTargets() {
        Set<String> targets = new LinkedHashSet<>();
        events.forEach(e -> targets.addAll(e.getAllTargets()));
        return targets;
    }

    public boolean hasCascading() {
        return events.stream().anyMatch(e -> e.isCascadingRoot() || e.isCascadingEffect());
    }

    public void resetEventStates() {
        events.forEach(FailureEvent::resetState);
    }

    /**
     * Deep copy under a new id.
     */
    public FailureScenario copy(String newId) {
        FailureScenario copy = new FailureScenario(newId);
        copy.name = name + " (copy)";
        copy.description = description;
        events.forEach(e -> copy.events.add(e.copy()));
        cascadingRules.forEach(r -> copy.cascadingRules.add(r.copy()));
        copy.category = category;
        copy.severity = severity;
        copy.tags.addAll(tags);
        copy.enabled = enabled;
        copy.repeatCount = repeatCount;
        copy.randomSeed = randomSeed;
        copy.timeOffset = timeOffset;
        copy.timeScale = timeScale;
        return copy;
    }

    public FailureScenario copy() {
        FailureScenario copy = copy(id);
        copy.name = name;
        return copy;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public FailureScenario setName(String name) {
        this.name = Objects.requireNonNull(name);
        return this;
    }

    public String getDescription() {
        return description;
    }

    public FailureScenario setDescription(String description) {
        this.description = Objects.requireNonNull(description);
        return this;
    }

    public List<CascadingFailureRule> getCascadingRules() {
        return Collections.unmodifiableList(cascadingRules);
    }

    public FailureScenario addCascadingRule(CascadingFailureRule rule) {
        cascadingRules.add(Objects.requireNonNull(rule));
        return this;
    }

    public FailureCategory getCategory() {
        return category;
    }

    public FailureScenario setCategory(FailureCategory category) {
        this.category = Objects.requireNonNull(category);
        return this;
    }

    public FailureSeverity getSeverity() {
        return severity;
    }

    public FailureScenario setSeverity(FailureSeverity severity) {
        this.severity = Objects.requireNonNull(severity);
        return this;
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public FailureScenario addTag(String tag) {
        tags.add(Objects.requireNonNull(tag));
        return this;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public FailureScenario setEnabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    public int getRepeatCount() {
        return repeatCount;
    }

    public FailureScenario setRepeatCount(int repeatCount) {
        this.repeatCount = repeatCount;
        return this;
    }

    public int getRandomSeed() {
        return randomSeed;
    }

    public FailureScenario setRandomSeed(int randomSeed) {
        this.randomSeed = randomSeed;
        return this;
    }

    public double getTimeOffset() {
        return timeOffset;
    }

    public FailureScenario setTimeOffset(double timeOffset) {
        this.timeOffset = timeOffset;
        return this;
    }

    public double getTimeScale() {
        return timeScale;
    }

    public FailureScenario setTimeScale(double timeScale) {
        this.timeScale = timeScale;
        return this;
    }
}
