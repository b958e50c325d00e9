/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import com.powsybl.gridcomm.network.NodeKind;

/**
 * Grid equipment type of a node. The type fixes the generic node kind used for code generation, and the role,
 * scan class and protocol a node gets when it does not override them.
 */
public enum GridNodeType {
    CONTROL_CENTER(NodeKind.HOST, GridNodeRole.MASTER, ScanClass.INTEGRITY, GridProtocol.DNP3),
    BACKUP_CONTROL_CENTER(NodeKind.HOST, GridNodeRole.MASTER, ScanClass.CLASS_2, GridProtocol.DNP3),
    SUBSTATION(NodeKind.SWITCH),
    RTU(NodeKind.HOST),
    IED(NodeKind.HOST, GridNodeRole.SLAVE, ScanClass.CLASS_1, GridProtocol.IEC_61850),
    DATA_CONCENTRATOR(NodeKind.HOST, GridNodeRole.INTERMEDIATE, ScanClass.CLASS_2, GridProtocol.DNP3),
    RELAY(NodeKind.HOST, GridNodeRole.SLAVE, ScanClass.CLASS_1, GridProtocol.IEC_61850),
    METER(NodeKind.HOST),
    GATEWAY(NodeKind.ROUTER, GridNodeRole.INTERMEDIATE, ScanClass.CLASS_2, GridProtocol.DNP3),
    COMM_ROUTER(NodeKind.ROUTER),
    COMM_SWITCH(NodeKind.SWITCH),
    COMM_TOWER(NodeKind.HOST),
    SATELLITE_TERMINAL(NodeKind.HOST),
    CELLULAR_GATEWAY(NodeKind.HOST),
    HISTORIAN(NodeKind.HOST),
    HMI(NodeKind.HOST);

    private final NodeKind baseKind;

    private final GridNodeRole defaultRole;

    private final ScanClass defaultScanClass;

    private final GridProtocol defaultProtocol;

    GridNodeType(NodeKind baseKind) {
        this(baseKind, GridNodeRole.SLAVE, ScanClass.CLASS_2, GridProtocol.DNP3);
    }

    GridNodeType(NodeKind baseKind, GridNodeRole defaultRole, ScanClass defaultScanClass, GridProtocol defaultProtocol) {
        this.baseKind = baseKind;
        this.defaultRole = defaultRole;
        this.defaultScanClass = defaultScanClass;
        this.defaultProtocol = defaultProtocol;
    }

    public NodeKind getBaseKind() {
        return baseKind;
    }

    public GridNodeRole getDefaultRole() {
        return defaultRole;
    }

    public ScanClass getDefaultScanClass() {
        return defaultScanClass;
    }

    public GridProtocol getDefaultProtocol() {
        return defaultProtocol;
    }

    public boolean isFieldDevice() {
        return this == RTU || this == IED || this == RELAY || this == METER;
    }
}
