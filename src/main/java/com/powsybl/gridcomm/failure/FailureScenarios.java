/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.failure;

import java.util.List;
import java.util.Objects;

/**
 * Ready-made failure scenarios.
 */
public final class FailureScenarios {

    public static final double TRIGGER_TIME_DEFAULT_VALUE = 10.0;

    private FailureScenarios() {
    }

    public static FailureScenario singleLinkFailure(String linkId) {
        return singleLinkFailure(linkId, TRIGGER_TIME_DEFAULT_VALUE, 30.0);
    }

    public static FailureScenario singleLinkFailure(String linkId, double triggerTime, double duration) {
        Objects.requireNonNull(linkId);
        FailureScenario scenario = new FailureScenario("link-failure-" + linkId)
                .setName("Single Link Failure - " + linkId)
                .setDescription("Tests system response to a single link failure")
                .setCategory(FailureCategory.EQUIPMENT)
                .setSeverity(FailureSeverity.MINOR);
        scenario.addEvent(new FailureEvent("link_down_" + linkId, FailureEventType.LINK_DOWN)
                .setName("link_down_" + linkId)
                .setTargetType(FailureTargetType.LINK)
                .setTargetId(linkId)
                .setTriggerTime(triggerTime)
                .setDuration(duration));
        return scenario;
    }

    public static FailureScenario nodePowerLoss(String nodeId) {
        return nodePowerLoss(nodeId, TRIGGER_TIME_DEFAULT_VALUE, 60.0);
    }

    public static FailureScenario nodePowerLoss(String nodeId, double triggerTime, double duration) {
        Objects.requireNonNull(nodeId);
        FailureScenario scenario = new FailureScenario("power-loss-" + nodeId)
                .setName("Node Power Loss - " + nodeId)
                .setDescription("Tests system response to complete node failure")
                .setCategory(FailureCategory.EQUIPMENT)
                .setSeverity(FailureSeverity.MAJOR);
        scenario.addEvent(new FailureEvent("power_loss_" + nodeId, FailureEventType.NODE_POWER_LOSS)
                .setTargetType(FailureTargetType.NODE)
                .setTargetId(nodeId)
                .setTriggerTime(triggerTime)
                .setDuration(duration));
        return scenario;
    }

    /**
     * A permanent link failure followed, every {@code cascadeDelay} seconds, by the power loss of one affected node.
     */
    public static FailureScenario cascading(String initialLinkId, List<String> affectedNodeIds, double triggerTime, double cascadeDelay) {
        Objects.requireNonNull(initialLinkId);
        Objects.requireNonNull(affectedNodeIds);
        FailureScenario scenario = new FailureScenario("cascade-" + initialLinkId)
                .setName("Cascading Failure")
                .setDescription("Initial failure cascades to affect multiple components")
                .setCategory(FailureCategory.CASCADING)
                .setSeverity(FailureSeverity.CRITICAL);
        FailureEvent initial = new FailureEvent("initial_failure_" + initialLinkId, FailureEventType.LINK_DOWN)
                .setTargetType(FailureTargetType.LINK)
                .setTargetId(initialLinkId)
                .setTriggerTime(triggerTime)
                .setDuration(FailureEvent.PERMANENT);
        scenario.addEvent(initial);
        for (int i = 0; i < affectedNodeIds.size(); i++) {
            String nodeId = affectedNodeIds.get(i);
            FailureEvent effect = new FailureEvent("cascade_" + nodeId, FailureEventType.NODE_POWER_LOSS)
                    .setTargetType(FailureTargetType.NODE)
                    .setTargetId(nodeId)
                    .setTriggerTime(triggerTime + cascadeDelay * (i + 1))
                    .setDuration(FailureEvent.PERMANENT)
                    .setCausedByEvent(initial.getId());
            initial.addCausedEvent(effect.getId());
            scenario.addEvent(effect);
        }
        return scenario;
    }

    public static FailureScenario cascading(String initialLinkId, List<String> affectedNodeIds) {
        return cascading(initialLinkId, affectedNodeIds, TRIGGER_TIME_DEFAULT_VALUE, 5.0);
    }

    public static FailureScenario partition(List<String> groupANodeIds, List<String> groupBNodeIds, List<String> partitionLinkIds,
                                            double triggerTime, double duration) {
        FailureScenario scenario = new FailureScenario("partition")
                .setName("Network Partition")
                .setDescription("Network splits into isolated segments")
                .setCategory(FailureCategory.EQUIPMENT)
                .setSeverity(FailureSeverity.CRITICAL);
        FailureParameters parameters = new FailureParameters()
                .setGroupANodeIds(groupANodeIds)
                .setGroupBNodeIds(groupBNodeIds)
                .setPartitionLinkIds(partitionLinkIds);
        scenario.addEvent(new FailureEvent("partition", FailureEventType.PARTITION)
                .setTargetType(FailureTargetType.NETWORK)
                .setTargetIds(partitionLinkIds)
                .setTriggerTime(triggerTime)
                .setDuration(duration)
                .setParameters(parameters));
        return scenario;
    }

    public static FailureScenario controlCenterFailover(String primaryControlCenterId, String backupControlCenterId) {
        return controlCenterFailover(primaryControlCenterId, backupControlCenterId, TRIGGER_TIME_DEFAULT_VALUE, 120.0);
    }

    public static FailureScenario controlCenterFailover(String primaryControlCenterId, String backupControlCenterId,
                                                        double triggerTime, double outageDuration) {
        Objects.requireNonNull(primaryControlCenterId);
        Objects.requireNonNull(backupControlCenterId);
        FailureScenario scenario = new FailureScenario("cc-failover-" + primaryControlCenterId)
                .setName("Control Center Failover")
                .setDescription("Primary control center " + primaryControlCenterId + " fails, testing takeover by " + backupControlCenterId)
                .setCategory(FailureCategory.EQUIPMENT)
                .setSeverity(FailureSeverity.CRITICAL)
                .addTag("failover")
                .addTag("redundancy")
                .addTag("control_center");
        scenario.addEvent(new FailureEvent("cc_failure_" + primaryControlCenterId, FailureEventType.NODE_POWER_LOSS)
                .setTargetType(FailureTargetType.NODE)
                .setTargetId(primaryControlCenterId)
                .setTriggerTime(triggerTime)
                .setDuration(outageDuration)
                .setSeverity(FailureSeverity.CRITICAL));
        return scenario;
    }

    public static FailureScenario dosAttack(String targetId) {
        return dosAttack(targetId, TRIGGER_TIME_DEFAULT_VALUE, 30.0, 10000);
    }

    public static FailureScenario dosAttack(String targetId, double triggerTime, double duration, int floodRatePps) {
        Objects.requireNonNull(targetId);
        FailureScenario scenario = new FailureScenario("dos-" + targetId)
                .setName("DoS Attack on " + targetId)
                .setDescription("Denial of service attack via packet flooding")
                .setCategory(FailureCategory.CYBER)
                .setSeverity(FailureSeverity.CRITICAL)
                .addTag("cyber")
                .addTag("dos")
                .addTag("security");
        scenario.addEvent(new FailureEvent("dos_" + targetId, FailureEventType.DOS_FLOOD)
                .setTargetType(FailureTargetType.NODE)
                .setTargetId(targetId)
                .setTriggerTime(triggerTime)
                .setDuration(duration)
                .setSeverity(FailureSeverity.CRITICAL)
                .setParameters(new FailureParameters()
                        .setFloodRatePps(floodRatePps)
                        .setFloodPacketSize(64)));
        return scenario;
    }
}
