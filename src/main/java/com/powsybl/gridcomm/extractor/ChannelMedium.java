/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

/**
 * Physical channel recovered from a device helper install. This is a property of a link, never of a node.
 */
public enum ChannelMedium {
    POINT_TO_POINT("point-to-point"),
    CSMA("csma"),
    WIFI("wifi"),
    LTE("lte"),
    UNKNOWN("unknown");

    private final String label;

    ChannelMedium(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSharedMedium() {
        return this == CSMA || this == WIFI;
    }
}
