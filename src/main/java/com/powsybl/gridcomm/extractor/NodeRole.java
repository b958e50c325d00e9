/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

/**
 * Role guessed for an extracted node from its container name and its connectivity.
 */
public enum NodeRole {
    HOST("host"),
    ROUTER("router"),
    SWITCH("switch"),
    ACCESS_POINT("access_point"),
    UNKNOWN("unknown");

    private final String label;

    NodeRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
