/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.generator;

/**
 * Sections of a generated script, in execution order. Each section opens with its marker comment, which appears
 * exactly once in a script.
 */
public enum ScriptSection {
    NODES("Create Nodes"),
    CHANNELS("Create Channels and Bridges"),
    INTERNET_STACK("Install Internet Stack"),
    ADDRESSING("Assign IP Addresses"),
    ROUTING("Configure Routing"),
    APPLICATIONS("Install Applications"),
    FAILURES("Failure Scenario"),
    TRACING("Configure Tracing"),
    RUN("Run Simulation");

    private final String title;

    ScriptSection(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }

    public String getMarker() {
        return "# ==== " + title + " ====";
    }
}
