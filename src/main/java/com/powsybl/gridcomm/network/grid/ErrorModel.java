/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import java.util.Objects;

/**
 * Receive error model of a link, as understood by the simulator.
 */
public record ErrorModel(Kind kind, double errorRate) {

    public enum Kind {
        RATE("RateErrorModel"),
        BURST("BurstErrorModel");

        private final String simulatorClass;

        Kind(String simulatorClass) {
            this.simulatorClass = simulatorClass;
        }

        public String getSimulatorClass() {
            return simulatorClass;
        }
    }

    public static final String BIT_ERROR_UNIT = "ERROR_UNIT_BIT";

    public ErrorModel {
        Objects.requireNonNull(kind);
    }

    /**
     * Unit of the error rate, only defined for rate models which count bit errors.
     */
    public String errorUnit() {
        return kind == Kind.RATE ? BIT_ERROR_UNIT : null;
    }
}
