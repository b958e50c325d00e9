/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

/**
 * A DNP3 object header: group, variation and point count.
 */
public record Dnp3Object(int group, int variation, int count) {

    public static final int BINARY_INPUT = 1;
    public static final int BINARY_INPUT_EVENT = 2;
    public static final int BINARY_OUTPUT = 10;
    public static final int COUNTER = 20;
    public static final int ANALOG_INPUT = 30;
    public static final int ANALOG_INPUT_EVENT = 32;

    /**
     * Encoded size of one point of this object group.
     */
    public int getBytesPerPoint() {
        return switch (group) {
            case BINARY_INPUT, BINARY_OUTPUT -> 1;
            case BINARY_INPUT_EVENT, ANALOG_INPUT_EVENT -> 8;
            case COUNTER, ANALOG_INPUT -> 4;
            default -> 2;
        };
    }
}
