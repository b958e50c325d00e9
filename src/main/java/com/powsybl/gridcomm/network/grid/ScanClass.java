/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

/**
 * SCADA scan class, with the poll interval in milliseconds used when a node does not set its own.
 * The exception class is event driven and has no periodic poll.
 */
public enum ScanClass {
    EXCEPTION(0),
    CLASS_1(1000),
    CLASS_2(4000),
    CLASS_3(30000),
    INTEGRITY(60000);

    private final int pollIntervalMs;

    ScanClass(int pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getPollIntervalMs() {
        return pollIntervalMs;
    }
}
