/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

import java.util.Locale;

/**
 * Guesses from variable names. Scripts carry no node type, so container and helper names are the only hint.
 */
final class ContainerNames {

    private ContainerNames() {
    }

    static NodeRole inferRole(String containerName) {
        String name = containerName.toLowerCase(Locale.ROOT);
        if (name.contains("switch") || name.contains("bridge") || name.contains("hub")) {
            return NodeRole.SWITCH;
        }
        if (name.contains("router") || name.contains("gateway")) {
            return NodeRole.ROUTER;
        }
        if (name.contains("ap") && (name.contains("wifi") || name.contains("wlan")) || name.contains("accesspoint")) {
            return NodeRole.ACCESS_POINT;
        }
        return NodeRole.HOST;
    }

    static MediumHint inferMedium(String containerName) {
        String name = containerName.toLowerCase(Locale.ROOT);
        if (name.contains("wifista") || name.contains("wifi_sta") || name.contains("stanode")) {
            return MediumHint.WIFI_STATION;
        }
        if (name.contains("wifiap") || name.contains("wifi_ap") || name.contains("apnode")) {
            return MediumHint.WIFI_AP;
        }
        if (name.contains("wifi")) {
            return MediumHint.WIFI_STATION;
        }
        if (name.contains("ue") && name.contains("lte")) {
            return MediumHint.LTE_UE;
        }
        if (name.contains("enb") || name.contains("enodeb")) {
            return MediumHint.LTE_ENB;
        }
        if (name.contains("lte")) {
            return MediumHint.LTE_UE;
        }
        return MediumHint.WIRED;
    }

    /**
     * Channel of an install made through a variable whose construction was not seen.
     */
    static ChannelMedium inferDeviceMedium(String helperName) {
        String name = helperName.toLowerCase(Locale.ROOT);
        if (name.contains("p2p") || name.contains("pointtopoint")) {
            return ChannelMedium.POINT_TO_POINT;
        }
        if (name.contains("csma")) {
            return ChannelMedium.CSMA;
        }
        if (name.contains("wifi")) {
            return ChannelMedium.WIFI;
        }
        return ChannelMedium.UNKNOWN;
    }
}
