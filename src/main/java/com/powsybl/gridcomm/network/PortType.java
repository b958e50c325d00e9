/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

/**
 * Physical port type, with its nominal speed and the prefix used to name ports.
 */
public enum PortType {
    ETHERNET("10Mbps", "eth"),
    FAST_ETHERNET("100Mbps", "fa"),
    GIGABIT_ETHERNET("1Gbps", "gi"),
    TEN_GIGABIT("10Gbps", "te"),
    SERIAL("1.544Mbps", "se"),
    FIBER("10Gbps", "fi"),
    WIRELESS("54Mbps", "wlan");

    private final String speed;

    private final String prefix;

    PortType(String speed, String prefix) {
        this.speed = speed;
        this.prefix = prefix;
    }

    public String getSpeed() {
        return speed;
    }

    public String getPrefix() {
        return prefix;
    }
}
