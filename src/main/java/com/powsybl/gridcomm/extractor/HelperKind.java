/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

import java.util.Arrays;
import java.util.Optional;

/**
 * What a script variable holds, as far as topology extraction is concerned.
 */
enum HelperKind {
    NODE_CONTAINER("NodeContainer"),
    POINT_TO_POINT("PointToPointHelper"),
    CSMA("CsmaHelper"),
    WIFI("WifiHelper"),
    ADDRESS("Ipv4AddressHelper"),
    INTERNET_STACK("InternetStackHelper"),
    APPLICATION_HELPER(null),
    NET_DEVICE_CONTAINER(null),
    INTERFACE_CONTAINER(null),
    APPLICATION_CONTAINER(null),
    OTHER_HELPER(null);

    private final String className;

    HelperKind(String className) {
        this.className = className;
    }

    static Optional<HelperKind> ofClassName(String className) {
        return Arrays.stream(values())
                .filter(kind -> kind.className != null && kind.className.equals(className))
                .findFirst();
    }

    ChannelMedium getDeviceMedium() {
        return switch (this) {
            case POINT_TO_POINT -> ChannelMedium.POINT_TO_POINT;
            case CSMA -> ChannelMedium.CSMA;
            case WIFI -> ChannelMedium.WIFI;
            default -> null;
        };
    }
}
