/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import com.powsybl.gridcomm.simulation.TrafficApplication;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Kind of SCADA or protection traffic. Each class maps to the generic application that simulates it, and some
 * classes define the interval, priority, timeout, direction and packet size their flows default to.
 */
public enum GridTrafficClass {
    SCADA_INTEGRITY_POLL(TrafficApplication.ECHO, 60000, GridTrafficPriority.SCADA_NORMAL, 10000, true, null),
    SCADA_EXCEPTION_POLL(TrafficApplication.ECHO, 4000, GridTrafficPriority.SCADA_NORMAL, 5000, true, null),
    SCADA_RESPONSE,
    CONTROL_SELECT(TrafficApplication.ECHO, 0, GridTrafficPriority.CONTROL, 2000, true, null),
    CONTROL_OPERATE(TrafficApplication.ECHO, 0, GridTrafficPriority.CONTROL, 2000, true, null),
    CONTROL_DIRECT,
    CONTROL_RESPONSE,
    GOOSE(TrafficApplication.ONOFF, 1000, GridTrafficPriority.PROTECTION, 4, false, null),
    SAMPLED_VALUES(TrafficApplication.ECHO, 0, GridTrafficPriority.PROTECTION, null, false, null),
    MMS_REPORT,
    TELEMETRY_ANALOG(TrafficApplication.ONOFF, 1000, GridTrafficPriority.MONITORING, null, false, null),
    TELEMETRY_STATUS,
    TELEMETRY_SOE,
    HEARTBEAT(TrafficApplication.ECHO, 30000, GridTrafficPriority.BEST_EFFORT, 10000, true, 20),
    TIME_SYNC(TrafficApplication.ECHO, 1000, GridTrafficPriority.SCADA_HIGH, null, true, 48),
    FILE_TRANSFER(TrafficApplication.BULK_SEND, 0, GridTrafficPriority.BEST_EFFORT, 30000, true, null),
    HISTORICAL_DATA,
    EVENT_ALARM,
    EVENT_LOG,
    ICCP_DATA,
    ICCP_CONTROL;

    private final TrafficApplication baseApplication;

    private final Integer defaultIntervalMs;

    private final GridTrafficPriority defaultPriority;

    private final Integer defaultTimeoutMs;

    private final Boolean defaultBidirectional;

    private final Integer defaultPacketSize;

    GridTrafficClass() {
        this(TrafficApplication.ECHO, null, null, null, null, null);
    }

    GridTrafficClass(TrafficApplication baseApplication, Integer defaultIntervalMs, GridTrafficPriority defaultPriority,
                     Integer defaultTimeoutMs, Boolean defaultBidirectional, Integer defaultPacketSize) {
        this.baseApplication = baseApplication;
        this.defaultIntervalMs = defaultIntervalMs;
        this.defaultPriority = defaultPriority;
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.defaultBidirectional = defaultBidirectional;
        this.defaultPacketSize = defaultPacketSize;
    }

    public TrafficApplication getBaseApplication() {
        return baseApplication;
    }

    public OptionalInt getDefaultIntervalMs() {
        return defaultIntervalMs != null ? OptionalInt.of(defaultIntervalMs) : OptionalInt.empty();
    }

    public Optional<GridTrafficPriority> getDefaultPriority() {
        return Optional.ofNullable(defaultPriority);
    }

    public OptionalInt getDefaultTimeoutMs() {
        return defaultTimeoutMs != null ? OptionalInt.of(defaultTimeoutMs) : OptionalInt.empty();
    }

    public Optional<Boolean> getDefaultBidirectional() {
        return Optional.ofNullable(defaultBidirectional);
    }

    public OptionalInt getDefaultPacketSize() {
        return defaultPacketSize != null ? OptionalInt.of(defaultPacketSize) : OptionalInt.empty();
    }

    public boolean isProtection() {
        return this == GOOSE || this == SAMPLED_VALUES;
    }

    public boolean isControl() {
        return this == CONTROL_SELECT || this == CONTROL_OPERATE || this == CONTROL_DIRECT;
    }

    public boolean isPolling() {
        return this == SCADA_INTEGRITY_POLL || this == SCADA_EXCEPTION_POLL;
    }
}
