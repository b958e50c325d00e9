/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Run duration, tracing switches and traffic of one simulation.
 */
public class SimulationConfig {

    public static final double DURATION_DEFAULT_VALUE = 10;

    public static final boolean ENABLE_PCAP_DEFAULT_VALUE = false;

    public static final boolean ENABLE_ASCII_TRACE_DEFAULT_VALUE = true;

    public static final boolean ENABLE_FLOW_MONITOR_DEFAULT_VALUE = true;

    public static final int RANDOM_SEED_DEFAULT_VALUE = 1;

    private double duration = DURATION_DEFAULT_VALUE;

    private final List<TrafficFlow> flows = new ArrayList<>();

    private boolean enablePcap = ENABLE_PCAP_DEFAULT_VALUE;

    private boolean enableAsciiTrace = ENABLE_ASCII_TRACE_DEFAULT_VALUE;

    private boolean enableFlowMonitor = ENABLE_FLOW_MONITOR_DEFAULT_VALUE;

    private int randomSeed = RANDOM_SEED_DEFAULT_VALUE;

    public double getDuration() {
        return duration;
    }

    public SimulationConfig setDuration(double duration) {
        if (duration <= 0) {
            throw new IllegalArgumentException("Simulation duration must be positive: " + duration);
        }
        this.duration = duration;
        return this;
    }

    public List<TrafficFlow> getFlows() {
        return Collections.unmodifiableList(flows);
    }

    public SimulationConfig addFlow(TrafficFlow flow) {
        flows.add(Objects.requireNonNull(flow));
        return this;
    }

    public SimulationConfig setFlows(List<? extends TrafficFlow> flows) {
        this.flows.clear();
        this.flows.addAll(Objects.requireNonNull(flows));
        return this;
    }

    public boolean isEnablePcap() {
        return enablePcap;
    }

    public SimulationConfig setEnablePcap(boolean enablePcap) {
        this.enablePcap = enablePcap;
        return this;
    }

    public boolean isEnableAsciiTrace() {
        return enableAsciiTrace;
    }

    public SimulationConfig setEnableAsciiTrace(boolean enableAsciiTrace) {
        this.enableAsciiTrace = enableAsciiTrace;
        return this;
    }

    public boolean isEnableFlowMonitor() {
        return enableFlowMonitor;
    }

    public SimulationConfig setEnableFlowMonitor(boolean enableFlowMonitor) {
        this.enableFlowMonitor = enableFlowMonitor;
        return this;
    }

    public int getRandomSeed() {
        return randomSeed;
    }

    public SimulationConfig setRandomSeed(int randomSeed) {
        this.randomSeed = randomSeed;
        return this;
    }

    @Override
    public String toString() {
        return "SimulationConfig(duration=" + duration
                + ", flows=" + flows.size()
                + ", enablePcap=" + enablePcap
                + ", enableAsciiTrace=" + enableAsciiTrace
                + ", enableFlowMonitor=" + enableFlowMonitor
                + ", randomSeed=" + randomSeed
                + ")";
    }
}
