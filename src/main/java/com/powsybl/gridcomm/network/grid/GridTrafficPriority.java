/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

/**
 * QoS priority of grid traffic with its DSCP code point.
 */
public enum GridTrafficPriority {
    PROTECTION(46, "EF"),
    CONTROL(34, "AF41"),
    SCADA_HIGH(26, "AF31"),
    SCADA_NORMAL(18, "AF21"),
    MONITORING(10, "AF11"),
    BEST_EFFORT(0, "BE");

    private final int dscp;

    private final String dscpName;

    GridTrafficPriority(int dscp, String dscpName) {
        this.dscp = dscp;
        this.dscpName = dscpName;
    }

    public int getDscp() {
        return dscp;
    }

    public String getDscpName() {
        return dscpName;
    }
}
