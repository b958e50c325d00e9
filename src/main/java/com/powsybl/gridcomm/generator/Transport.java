/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.generator;

import com.powsybl.gridcomm.address.AddressPolicy;
import com.powsybl.gridcomm.network.Link;
import com.powsybl.gridcomm.network.Network;
import com.powsybl.gridcomm.network.grid.GridLink;

/**
 * How a wired link is carried by the simulator.
 */
public enum Transport {
    POINT_TO_POINT("p2p", "PointToPointHelper"),
    CSMA("csma", "CsmaHelper");

    private final String variablePrefix;

    private final String helperClass;

    Transport(String variablePrefix, String helperClass) {
        this.variablePrefix = variablePrefix;
        this.helperClass = helperClass;
    }

    public String getVariablePrefix() {
        return variablePrefix;
    }

    public String getHelperClass() {
        return helperClass;
    }

    /**
     * Shared medium is used for links touching a switch and for links whose channel is explicitly a shared medium,
     * any other link gets a dedicated channel.
     */
    public static Transport of(Network network, Link link) {
        if (AddressPolicy.touchesSwitch(network, link)) {
            return CSMA;
        }
        if (link instanceof GridLink gridLink) {
            return switch (gridLink.getGridLinkType()) {
                case ETHERNET_LAN -> CSMA;
                case FIBER, COPPER_SERIAL, MICROWAVE, LICENSED_RADIO, SPREAD_SPECTRUM, CELLULAR_LTE, CELLULAR_5G,
                     PRIVATE_LTE, SATELLITE_GEO, SATELLITE_LEO, WIFI_MESH, WIMAX, ZIGBEE, EMULATED -> POINT_TO_POINT;
            };
        }
        return switch (link.getChannel()) {
            case CSMA -> CSMA;
            case POINT_TO_POINT, WIFI -> POINT_TO_POINT;
        };
    }
}
