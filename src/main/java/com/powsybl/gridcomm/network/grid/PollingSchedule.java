/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import java.util.*;

/**
 * SCADA polling plan of a control center: devices are spread over scan groups, each polled at its own interval and
 * staggered inside the group.
 */
public class PollingSchedule {

    public static final int INTEGRITY_INTERVAL_MS_DEFAULT_VALUE = 60000;
    public static final int EXCEPTION_INTERVAL_MS_DEFAULT_VALUE = 4000;

    /**
     * Average bytes exchanged by one poll and its response.
     */
    static final int BYTES_PER_POLL = 700;

    public static class Group {

        private final String name;

        private final int intervalMs;

        private final int staggerMs;

        private final List<String> deviceIds = new ArrayList<>();

        public Group(String name, int intervalMs, int staggerMs) {
            this.name = Objects.requireNonNull(name);
            this.intervalMs = intervalMs;
            this.staggerMs = staggerMs;
        }

        public String getName() {
            return name;
        }

        public int getIntervalMs() {
            return intervalMs;
        }

        public int getStaggerMs() {
            return staggerMs;
        }

        public List<String> getDeviceIds() {
            return Collections.unmodifiableList(deviceIds);
        }
    }

    private final String id;

    private String name = "Default Schedule";

    private final String controlCenterId;

    private final List<Group> groups = new ArrayList<>();

    private int integrityIntervalMs = INTEGRITY_INTERVAL_MS_DEFAULT_VALUE;

    private int exceptionIntervalMs = EXCEPTION_INTERVAL_MS_DEFAULT_VALUE;

    public PollingSchedule(String id, String controlCenterId) {
        this.id = Objects.requireNonNull(id);
        this.controlCenterId = Objects.requireNonNull(controlCenterId);
        groups.add(new Group("Class 1 (Fast)", 1000, 50));
        groups.add(new Group("Class 2 (Normal)", 4000, 100));
        groups.add(new Group("Class 3 (Slow)", 30000, 500));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public PollingSchedule setName(String name) {
        this.name = Objects.requireNonNull(name);
        return this;
    }

    public String getControlCenterId() {
        return controlCenterId;
    }

    public List<Group> getGroups() {
        return Collections.unmodifiableList(groups);
    }

    public int getIntegrityIntervalMs() {
        return integrityIntervalMs;
    }

    public PollingSchedule setIntegrityIntervalMs(int integrityIntervalMs) {
        this.integrityIntervalMs = integrityIntervalMs;
        return this;
    }

    public int getExceptionIntervalMs() {
        return exceptionIntervalMs;
    }

    public PollingSchedule setExceptionIntervalMs(int exceptionIntervalMs) {
        this.exceptionIntervalMs = exceptionIntervalMs;
        return this;
    }

    /**
     * Adds a device to a group, ignoring out of range group indexes and devices already in that group.
     */
    public PollingSchedule addDevice(String deviceId, int groupIndex) {
        Objects.requireNonNull(deviceId);
        if (groupIndex >= 0 && groupIndex < groups.size()) {
            List<String> ids = groups.get(groupIndex).deviceIds;
            if (!ids.contains(deviceId)) {
                ids.add(deviceId);
            }
        }
        return this;
    }

    public PollingSchedule addDevice(String deviceId) {
        return addDevice(deviceId, 1);
    }

    public void removeDevice(String deviceId) {
        groups.forEach(g -> g.deviceIds.remove(deviceId));
    }

    public Optional<Group> getDeviceGroup(String deviceId) {
        return groups.stream().filter(g -> g.deviceIds.contains(deviceId)).findFirst();
    }

    /**
     * One exception poll per scheduled device, reading all event classes. Flow ids are
     * {@code <schedule id>_poll<n>} numbered from 1 in group order.
     */
    public List<GridTrafficFlow> generateTrafficFlows() {
        List<GridTrafficFlow> flows = new ArrayList<>();
        int n = 0;
        for (Group group : groups) {
            for (int i = 0; i < group.deviceIds.size(); i++) {
                GridTrafficFlow flow = new GridTrafficFlow(id + "_poll" + ++n, controlCenterId, group.deviceIds.get(i),
                        GridTrafficClass.SCADA_EXCEPTION_POLL, new GridTrafficFlow.Overrides().setIntervalMs(group.intervalMs));
                flow.setInitialDelayMs(i * group.staggerMs);
                flow.getDnp3Config().setAllClasses(true);
                flows.add(flow);
            }
        }
        return flows;
    }

    public double getTotalPollsPerMinute() {
        double total = 0;
        for (Group group : groups) {
            if (group.intervalMs > 0) {
                total += 60000.0 / group.intervalMs * group.deviceIds.size();
            }
        }
        return total;
    }

    public double getEstimatedBandwidthKbps() {
        double pollsPerSecond = getTotalPollsPerMinute() / 60;
        return BYTES_PER_POLL * pollsPerSecond * 8 / 1000;
    }
}
