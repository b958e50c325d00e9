/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.failure;

/**
 * Kinds of failures that can be scheduled against a network.
 */
public enum FailureEventType {
    // link
    LINK_DOWN,
    LINK_UP,
    LINK_DEGRADED,
    LINK_RESTORED,
    LINK_FLAPPING,
    LINK_CONGESTION,
    LINK_ERROR_RATE,

    // node
    NODE_POWER_LOSS,
    NODE_POWER_RESTORE,
    NODE_REBOOT,
    NODE_CPU_OVERLOAD,
    NODE_MEMORY_EXHAUSTION,
    NODE_INTERFACE_DOWN,
    NODE_INTERFACE_UP,

    // network wide
    PARTITION,
    PARTITION_HEAL,
    BROADCAST_STORM,
    ROUTING_FAILURE,
    ROUTING_CONVERGENCE,

    // cyber
    DOS_FLOOD,
    DOS_SLOWLORIS,
    MITM_DELAY,
    MITM_DROP,
    PACKET_REPLAY,
    PACKET_INJECTION,

    // environmental
    WEATHER_INTERFERENCE,
    SOLAR_FLARE,
    PHYSICAL_DAMAGE,

    // maintenance
    PLANNED_OUTAGE,
    FAILOVER_TEST;

    public FailureTargetType getDefaultTargetType() {
        if (name().startsWith("LINK_")) {
            return FailureTargetType.LINK;
        } else if (name().startsWith("NODE_")) {
            return FailureTargetType.NODE;
        }
        return FailureTargetType.NETWORK;
    }
}
