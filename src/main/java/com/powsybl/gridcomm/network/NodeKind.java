/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

/**
 * @see Node
 */
public enum NodeKind {
    HOST(1, PortType.GIGABIT_ETHERNET),
    ROUTER(4, PortType.GIGABIT_ETHERNET),
    SWITCH(8, PortType.GIGABIT_ETHERNET),
    STATION(1, PortType.WIRELESS),
    ACCESS_POINT(2, PortType.WIRELESS),
    APPLICATION(1, PortType.GIGABIT_ETHERNET);

    private final int defaultPortCount;

    private final PortType defaultPortType;

    NodeKind(int defaultPortCount, PortType defaultPortType) {
        this.defaultPortCount = defaultPortCount;
        this.defaultPortType = defaultPortType;
    }

    public int getDefaultPortCount() {
        return defaultPortCount;
    }

    public PortType getDefaultPortType() {
        return defaultPortType;
    }
}
