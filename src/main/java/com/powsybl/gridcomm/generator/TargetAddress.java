/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.generator;

/**
 * Where the script finds the address of a node: the interface container of a device group and the slot inside it.
 *
 * @param container name of the interface container variable
 * @param slot      index of the address in the container
 * @param address   the address itself, as resolved at generation time
 */
public record TargetAddress(String container, int slot, String address) {

    public String expression() {
        return container + ".GetAddress(" + slot + ")";
    }
}
