/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import com.powsybl.gridcomm.simulation.TrafficFlow;
import org.apache.commons.lang3.StringUtils;

import java.util.*;

/**
 * A traffic flow refined with its SCADA traffic class.
 * <p>
 * The application follows the class. Interval, priority, timeout, direction, packet size and port come from
 * {@link Overrides} when set, then from the class defaults, then from the generic flow defaults, except the port
 * which defaults to the DNP3 port. The echo interval is kept in sync with a positive interval.
 */
public class GridTrafficFlow extends TrafficFlow {

    public static final int SCADA_PORT_DEFAULT_VALUE = 20000;
    public static final int TIMEOUT_MS_DEFAULT_VALUE = 5000;
    public static final int EFFECTIVE_INTERVAL_MS_DEFAULT_VALUE = 4000;
    public static final int RETRY_COUNT_DEFAULT_VALUE = 3;
    public static final double REQUIRED_SUCCESS_RATE_DEFAULT_VALUE = 0.99;

    public static class Overrides {

        private GridTrafficPriority priority;

        private Integer intervalMs;

        private Integer timeoutMs;

        private Boolean bidirectional;

        private Integer port;

        private Integer packetSize;

        public Optional<GridTrafficPriority> getPriority() {
            return Optional.ofNullable(priority);
        }

        public Overrides setPriority(GridTrafficPriority priority) {
            this.priority = priority;
            return this;
        }

        public Optional<Integer> getIntervalMs() {
            return Optional.ofNullable(intervalMs);
        }

        public Overrides setIntervalMs(Integer intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        public Optional<Integer> getTimeoutMs() {
            return Optional.ofNullable(timeoutMs);
        }

        public Overrides setTimeoutMs(Integer timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Optional<Boolean> getBidirectional() {
            return Optional.ofNullable(bidirectional);
        }

        public Overrides setBidirectional(Boolean bidirectional) {
            this.bidirectional = bidirectional;
            return this;
        }

        public Optional<Integer> getPort() {
            return Optional.ofNullable(port);
        }

        public Overrides setPort(Integer port) {
            this.port = port;
            return this;
        }

        public Optional<Integer> getPacketSize() {
            return Optional.ofNullable(packetSize);
        }

        public Overrides setPacketSize(Integer packetSize) {
            this.packetSize = packetSize;
            return this;
        }
    }

    private final GridTrafficClass trafficClass;

    private GridTrafficPriority priority;

    private final int intervalMs;

    private int timeoutMs;

    private boolean bidirectional;

    private final List<String> additionalTargetIds = new ArrayList<>();

    private String multicastGroup = "";

    private int initialDelayMs = 0;

    private int jitterMs = 0;

    private GridProtocol gridProtocol = GridProtocol.DNP3;

    private final Dnp3MessageConfig dnp3Config;

    private GooseMessageConfig gooseConfig;

    private int retryCount = RETRY_COUNT_DEFAULT_VALUE;

    private double requiredSuccessRate = REQUIRED_SUCCESS_RATE_DEFAULT_VALUE;

    private int burstCount = 1;

    public GridTrafficFlow(String id, String sourceNodeId, String targetNodeId, GridTrafficClass trafficClass) {
        this(id, sourceNodeId, targetNodeId, trafficClass, new Overrides());
    }

    public GridTrafficFlow(String id, String sourceNodeId, String targetNodeId, GridTrafficClass trafficClass,
                           Overrides overrides) {
        super(id, sourceNodeId, targetNodeId);
        this.trafficClass = Objects.requireNonNull(trafficClass);
        Objects.requireNonNull(overrides);
        name = trafficClass.name().toLowerCase(Locale.ROOT) + "_" + StringUtils.left(id, 4);
        application = trafficClass.getBaseApplication();
        intervalMs = overrides.getIntervalMs().orElse(trafficClass.getDefaultIntervalMs().orElse(0));
        priority = overrides.getPriority().orElse(trafficClass.getDefaultPriority().orElse(GridTrafficPriority.SCADA_NORMAL));
        timeoutMs = overrides.getTimeoutMs().orElse(trafficClass.getDefaultTimeoutMs().orElse(TIMEOUT_MS_DEFAULT_VALUE));
        bidirectional = overrides.getBidirectional().orElse(trafficClass.getDefaultBidirectional().orElse(true));
        packetSize = overrides.getPacketSize().orElse(trafficClass.getDefaultPacketSize().orElse(PACKET_SIZE_DEFAULT_VALUE));
        port = overrides.getPort().orElse(SCADA_PORT_DEFAULT_VALUE);
        if (intervalMs > 0) {
            echoInterval = intervalMs / 1000.0;
        }
        dnp3Config = trafficClass == GridTrafficClass.SCADA_INTEGRITY_POLL
                ? Dnp3MessageConfig.integrityPoll()
                : new Dnp3MessageConfig();
        if (trafficClass == GridTrafficClass.GOOSE) {
            gridProtocol = GridProtocol.GOOSE;
            gooseConfig = new GooseMessageConfig();
        }
    }

    protected GridTrafficFlow(GridTrafficFlow other) {
        super(other);
        trafficClass = other.trafficClass;
        priority = other.priority;
        intervalMs = other.intervalMs;
        timeoutMs = other.timeoutMs;
        bidirectional = other.bidirectional;
        additionalTargetIds.addAll(other.additionalTargetIds);
        multicastGroup = other.multicastGroup;
        initialDelayMs = other.initialDelayMs;
        jitterMs = other.jitterMs;
        gridProtocol = other.gridProtocol;
        dnp3Config = other.dnp3Config.copy();
        gooseConfig = other.gooseConfig != null ? other.gooseConfig.copy() : null;
        retryCount = other.retryCount;
        requiredSuccessRate = other.requiredSuccessRate;
        burstCount = other.burstCount;
    }

    @Override
    public GridTrafficFlow copy() {
        return new GridTrafficFlow(this);
    }

    public GridTrafficClass getTrafficClass() {
        return trafficClass;
    }

    public GridTrafficPriority getPriority() {
        return priority;
    }

    public GridTrafficFlow setPriority(GridTrafficPriority priority) {
        this.priority = Objects.requireNonNull(priority);
        return this;
    }

    public int getDscp() {
        return priority.getDscp();
    }

    public int getIntervalMs() {
        return intervalMs;
    }

    /**
     * The flow interval when positive, otherwise the class interval, otherwise 4 s.
     */
    public int getEffectiveIntervalMs() {
        if (intervalMs > 0) {
            return intervalMs;
        }
        return trafficClass.getDefaultIntervalMs().orElse(EFFECTIVE_INTERVAL_MS_DEFAULT_VALUE);
    }

    public boolean isPeriodic() {
        return intervalMs > 0;
    }

    public boolean isProtectionClass() {
        return trafficClass.isProtection();
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public GridTrafficFlow setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
        return this;
    }

    public boolean isBidirectional() {
        return bidirectional;
    }

    public GridTrafficFlow setBidirectional(boolean bidirectional) {
        this.bidirectional = bidirectional;
        return this;
    }

    public List<String> getAdditionalTargetIds() {
        return Collections.unmodifiableList(additionalTargetIds);
    }

    public GridTrafficFlow addTarget(String nodeId) {
        additionalTargetIds.add(Objects.requireNonNull(nodeId));
        return this;
    }

    public String getMulticastGroup() {
        return multicastGroup;
    }

    public GridTrafficFlow setMulticastGroup(String multicastGroup) {
        this.multicastGroup = Objects.requireNonNull(multicastGroup);
        return this;
    }

    public int getInitialDelayMs() {
        return initialDelayMs;
    }

    public GridTrafficFlow setInitialDelayMs(int initialDelayMs) {
        this.initialDelayMs = initialDelayMs;
        return this;
    }

    public int getJitterMs() {
        return jitterMs;
    }

    public GridTrafficFlow setJitterMs(int jitterMs) {
        this.jitterMs = jitterMs;
        return this;
    }

    public GridProtocol getGridProtocol() {
        return gridProtocol;
    }

    public GridTrafficFlow setGridProtocol(GridProtocol gridProtocol) {
        this.gridProtocol = Objects.requireNonNull(gridProtocol);
        return this;
    }

    public Dnp3MessageConfig getDnp3Config() {
        return dnp3Config;
    }

    public Optional<GooseMessageConfig> getGooseConfig() {
        return Optional.ofNullable(gooseConfig);
    }

    public GridTrafficFlow setGooseConfig(GooseMessageConfig gooseConfig) {
        this.gooseConfig = gooseConfig;
        return this;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public GridTrafficFlow setRetryCount(int retryCount) {
        this.retryCount = retryCount;
        return this;
    }

    public double getRequiredSuccessRate() {
        return requiredSuccessRate;
    }

    public GridTrafficFlow setRequiredSuccessRate(double requiredSuccessRate) {
        this.requiredSuccessRate = requiredSuccessRate;
        return this;
    }

    public int getBurstCount() {
        return burstCount;
    }

    public GridTrafficFlow setBurstCount(int burstCount) {
        this.burstCount = burstCount;
        return this;
    }
}
