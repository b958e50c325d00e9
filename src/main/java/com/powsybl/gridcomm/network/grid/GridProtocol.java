/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

public enum GridProtocol {
    DNP3,
    IEC_61850,
    IEC_60870_5_104,
    MODBUS_TCP,
    ICCP,
    GOOSE,
    MMS,
    OPC_UA
}
