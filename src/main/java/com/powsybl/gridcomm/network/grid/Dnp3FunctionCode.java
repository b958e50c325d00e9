/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

/**
 * DNP3 application layer function codes.
 */
public enum Dnp3FunctionCode {
    READ(0x01),
    WRITE(0x02),
    SELECT(0x03),
    OPERATE(0x04),
    DIRECT_OPERATE(0x05),
    DIRECT_OPERATE_NR(0x06),
    COLD_RESTART(0x0D),
    WARM_RESTART(0x0E),
    ENABLE_UNSOLICITED(0x14),
    DISABLE_UNSOLICITED(0x15),
    DELAY_MEASURE(0x17),
    RESPONSE(0x81),
    UNSOLICITED_RESPONSE(0x82);

    private final int code;

    Dnp3FunctionCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
