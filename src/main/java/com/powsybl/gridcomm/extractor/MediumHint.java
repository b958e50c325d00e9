/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

/**
 * Medium a node is attached with, guessed from the helpers used to install its devices.
 */
public enum MediumHint {
    WIRED("wired"),
    WIFI_STATION("wifi_sta"),
    WIFI_AP("wifi_ap"),
    LTE_UE("lte_ue"),
    LTE_ENB("lte_enb");

    private final String label;

    MediumHint(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isWireless() {
        return this != WIRED;
    }
}
