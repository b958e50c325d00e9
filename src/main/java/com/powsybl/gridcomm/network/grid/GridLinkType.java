/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import com.powsybl.gridcomm.network.ChannelKind;
import com.powsybl.gridcomm.network.Link;

/**
 * Communication technology of a grid link, with its nominal rate, delay, bit error rate and reliability class.
 */
public enum GridLinkType {
    FIBER(ChannelKind.POINT_TO_POINT, "1Gbps", "0.1ms", 1e-12, ReliabilityClass.HIGH),
    COPPER_SERIAL(ChannelKind.POINT_TO_POINT, "19200bps", "10ms", 1e-6, ReliabilityClass.STANDARD),
    ETHERNET_LAN(ChannelKind.CSMA, "1Gbps", "0.01ms", 1e-10, ReliabilityClass.HIGH),
    MICROWAVE(ChannelKind.POINT_TO_POINT, "100Mbps", "1ms", 1e-8, ReliabilityClass.HIGH),
    LICENSED_RADIO(ChannelKind.POINT_TO_POINT, "9600bps", "50ms", 1e-5, ReliabilityClass.STANDARD),
    SPREAD_SPECTRUM(ChannelKind.POINT_TO_POINT, "115200bps", "20ms", 1e-6, ReliabilityClass.STANDARD),
    CELLULAR_LTE(ChannelKind.POINT_TO_POINT, "50Mbps", "30ms", 1e-6, ReliabilityClass.STANDARD),
    CELLULAR_5G(ChannelKind.POINT_TO_POINT, "100Mbps", "10ms", 1e-7, ReliabilityClass.STANDARD),
    PRIVATE_LTE(ChannelKind.POINT_TO_POINT, "50Mbps", "20ms", 1e-7, ReliabilityClass.HIGH),
    SATELLITE_GEO(ChannelKind.POINT_TO_POINT, "5Mbps", "270ms", 1e-7, ReliabilityClass.BACKUP),
    SATELLITE_LEO(ChannelKind.POINT_TO_POINT, "50Mbps", "20ms", 1e-7, ReliabilityClass.STANDARD),
    WIFI_MESH(ChannelKind.WIFI, "54Mbps", "5ms", 1e-5, ReliabilityClass.BACKUP),
    WIMAX(ChannelKind.POINT_TO_POINT, "10Mbps", "30ms", 1e-6, ReliabilityClass.STANDARD),
    ZIGBEE(ChannelKind.POINT_TO_POINT, "250kbps", "10ms", 1e-5, ReliabilityClass.BEST_EFFORT),
    EMULATED(ChannelKind.POINT_TO_POINT, Link.DATA_RATE_DEFAULT_VALUE, Link.DELAY_DEFAULT_VALUE, 0.0, ReliabilityClass.STANDARD);

    private final ChannelKind channel;

    private final String defaultDataRate;

    private final String defaultDelay;

    private final double defaultBitErrorRate;

    private final ReliabilityClass defaultReliabilityClass;

    GridLinkType(ChannelKind channel, String defaultDataRate, String defaultDelay, double defaultBitErrorRate,
                 ReliabilityClass defaultReliabilityClass) {
        this.channel = channel;
        this.defaultDataRate = defaultDataRate;
        this.defaultDelay = defaultDelay;
        this.defaultBitErrorRate = defaultBitErrorRate;
        this.defaultReliabilityClass = defaultReliabilityClass;
    }

    public ChannelKind getChannel() {
        return channel;
    }

    public String getDefaultDataRate() {
        return defaultDataRate;
    }

    public String getDefaultDelay() {
        return defaultDelay;
    }

    public double getDefaultBitErrorRate() {
        return defaultBitErrorRate;
    }

    public ReliabilityClass getDefaultReliabilityClass() {
        return defaultReliabilityClass;
    }

    public boolean isWireless() {
        return this != FIBER && this != COPPER_SERIAL && this != ETHERNET_LAN && this != EMULATED;
    }

    public boolean isRadio() {
        return this == MICROWAVE || this == LICENSED_RADIO || this == SPREAD_SPECTRUM || this == WIFI_MESH;
    }

    public boolean isCellular() {
        return this == CELLULAR_LTE || this == CELLULAR_5G || this == PRIVATE_LTE;
    }

    public boolean isSatellite() {
        return this == SATELLITE_GEO || this == SATELLITE_LEO;
    }
}
