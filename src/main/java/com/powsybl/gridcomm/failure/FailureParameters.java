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
 * Type specific parameters of a failure event. Only the fields relevant to the event type are read.
 */
public class FailureParameters {

    // degradation
    private String newDataRate = "";
    private String newDelay = "";
    private String newJitter = "";
    private double errorRate = 0.0;

    // flapping
    private double upDuration = 5.0;
    private double downDuration = 2.0;
    private int flapCycles = 3;

    // congestion
    private int queueFillPercent = 95;
    private double dropProbability = 0.1;

    // reboot
    private double rebootDuration = 30.0;
    private double bootSequenceDelay = 5.0;

    // partition
    private final List<String> groupANodeIds = new ArrayList<>();
    private final List<String> groupBNodeIds = new ArrayList<>();
    private final List<String> partitionLinkIds = new ArrayList<>();

    // denial of service
    private int floodRatePps = 10000;
    private int floodPacketSize = 64;
    private int targetPort = 0;

    // man in the middle
    private double addedDelayMs = 50.0;
    private double mitmDropProbability = 0.1;
    private String affectedTrafficClass = "";

    // weather
    private double interferenceDb = 10.0;
    private final List<String> affectedLinkTypes = new ArrayList<>();

    private final Map<String, String> customAttributes = new LinkedHashMap<>();

    public FailureParameters copy() {
        FailureParameters copy = new FailureParameters();
        copy.newDataRate = newDataRate;
        copy.newDelay = newDelay;
        copy.newJitter = newJitter;
        copy.errorRate = errorRate;
        copy.upDuration = upDuration;
        copy.downDuration = downDuration;
        copy.flapCycles = flapCycles;
        copy.queueFillPercent = queueFillPercent;
        copy.dropProbability = dropProbability;
        copy.rebootDuration = rebootDuration;
        copy.bootSequenceDelay = bootSequenceDelay;
        copy.groupANodeIds.addAll(groupANodeIds);
        copy.groupBNodeIds.addAll(groupBNodeIds);
        copy.partitionLinkIds.addAll(partitionLinkIds);
        copy.floodRatePps = floodRatePps;
        copy.floodPacketSize = floodPacketSize;
        copy.targetPort = targetPort;
        copy.addedDelayMs = addedDelayMs;
        copy.mitmDropProbability = mitmDropProbability;
        copy.affectedTrafficClass = affectedTrafficClass;
        copy.interferenceDb = interferenceDb;
        copy.affectedLinkTypes.addAll(affectedLinkTypes);
        copy.customAttributes.putAll(customAttributes);
        return copy;
    }

    public String getNewDataRate() {
        return newDataRate;
    }

    public FailureParameters setNewDataRate(String newDataRate) {
        this.newDataRate = Objects.requireNonNull(newDataRate);
        return this;
    }

    public String getNewDelay() {
        return newDelay;
    }

    public FailureParameters setNewDelay(String newDelay) {
        this.newDelay = Objects.requireNonNull(newDelay);
        return this;
    }

    public String getNewJitter() {
        return newJitter;
    }

    public FailureParameters setNewJitter(String newJitter) {
        this.newJitter = Objects.requireNonNull(newJitter);
        return this;
    }

    public double getErrorRate() {
        return errorRate;
    }

    public FailureParameters setErrorRate(double errorRate) {
        this.errorRate = errorRate;
        return this;
    }

    public double getUpDuration() {
        return upDuration;
    }

    public FailureParameters setUpDuration(double upDuration) {
        this.upDuration = upDuration;
        return this;
    }

    public double getDownDuration() {
        return downDuration;
    }

    public FailureParameters setDownDuration(double downDuration) {
        this.downDuration = downDuration;
        return this;
    }

    public int getFlapCycles() {
        return flapCycles;
    }

    public FailureParameters setFlapCycles(int flapCycles) {
        this.flapCycles = flapCycles;
        return this;
    }

    public int getQueueFillPercent() {
        return queueFillPercent;
    }

    public FailureParameters setQueueFillPercent(int queueFillPercent) {
        this.queueFillPercent = queueFillPercent;
        return this;
    }

    public double getDropProbability() {
        return dropProbability;
    }

    public FailureParameters setDropProbability(double dropProbability) {
        this.dropProbability = dropProbability;
        return this;
    }

    public double getRebootDuration() {
        return rebootDuration;
    }

    public FailureParameters setRebootDuration(double rebootDuration) {
        this.rebootDuration = rebootDuration;
        return this;
    }

    public double getBootSequenceDelay() {
        return bootSequenceDelay;
    }

    public FailureParameters setBootSequenceDelay(double bootSequenceDelay) {
        this.bootSequenceDelay = bootSequenceDelay;
        return this;
    }

    public List<String> getGroupANodeIds() {
        return Collections.unmodifiableList(groupANodeIds);
    }

    public FailureParameters setGroupANodeIds(List<String> nodeIds) {
        groupANodeIds.clear();
        groupANodeIds.addAll(nodeIds);
        return this;
    }

    public List<String> getGroupBNodeIds() {
        return Collections.unmodifiableList(groupBNodeIds);
    }

    public FailureParameters setGroupBNodeIds(List<String> nodeIds) {
        groupBNodeIds.clear();
        groupBNodeIds.addAll(nodeIds);
        return this;
    }

    public List<String> getPartitionLinkIds() {
        return Collections.unmodifiableList(partitionLinkIds);
    }

    public FailureParameters setPartitionLinkIds(List<String> linkIds) {
        partitionLinkIds.clear();
        partitionLinkIds.addAll(linkIds);
        return this;
    }

    public int getFloodRatePps() {
        return floodRatePps;
    }

    public FailureParameters setFloodRatePps(int floodRatePps) {
        this.floodRatePps = floodRatePps;
        return this;
    }

    public int getFloodPacketSize() {
        return floodPacketSize;
    }

    public FailureParameters setFloodPacketSize(int floodPacketSize) {
        this.floodPacketSize = floodPacketSize;
        return this;
    }

    public int getTargetPort() {
        return targetPort;
    }

    public FailureParameters setTargetPort(int targetPort) {
        this.targetPort = targetPort;
        return this;
    }

    public double getAddedDelayMs() {
        return addedDelayMs;
    }

    public FailureParameters setAddedDelayMs(double addedDelayMs) {
        this.addedDelayMs = addedDelayMs;
        return this;
    }

    public double getMitmDropProbability() {
        return mitmDropProbability;
    }

    public FailureParameters setMitmDropProbability(double mitmDropProbability) {
        this.mitmDropProbability = mitmDropProbability;
        return this;
    }

    public String getAffectedTrafficClass() {
        return affectedTrafficClass;
    }

    public FailureParameters setAffectedTrafficClass(String affectedTrafficClass) {
        this.affectedTrafficClass = Objects.requireNonNull(affectedTrafficClass);
        return this;
    }

    public double getInterferenceDb() {
        return interferenceDb;
    }

    public FailureParameters setInterferenceDb(double interferenceDb) {
        this.interferenceDb = interferenceDb;
        return this;
    }

    public List<String> getAffectedLinkTypes() {
        return Collections.unmodifiableList(affectedLinkTypes);
    }

    public FailureParameters setAffectedLinkTypes(List<String> linkTypes) {
        affectedLinkTypes.clear();
        affectedLinkTypes.addAll(linkTypes);
        return this;
    }

    public Map<String, String> getCustomAttributes() {
        return customAttributes;
    }
}
