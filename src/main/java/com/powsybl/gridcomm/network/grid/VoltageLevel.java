/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

public enum VoltageLevel {
    TRANSMISSION_500KV("500kV"),
    TRANSMISSION_345KV("345kV"),
    TRANSMISSION_230KV("230kV"),
    TRANSMISSION_138KV("138kV"),
    SUBTRANSMISSION_69KV("69kV"),
    DISTRIBUTION_34KV("34.5kV"),
    DISTRIBUTION_13KV("13.8kV"),
    DISTRIBUTION_4KV("4.16kV"),
    SECONDARY_480V("480V"),
    SECONDARY_240V("240V");

    private final String label;

    VoltageLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isTransmission() {
        return name().startsWith("TRANSMISSION");
    }
}
