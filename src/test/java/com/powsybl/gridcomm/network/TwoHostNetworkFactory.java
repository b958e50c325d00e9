/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

/**
 * Two hosts joined by one dedicated link, no address configured.
 */
public final class TwoHostNetworkFactory {

    private TwoHostNetworkFactory() {
    }

    /**
     *  A ---- B
     *     l1
     */
    public static Network create() {
        Network network = new Network("two-hosts").setAutoAddressing(false);
        network.addNode(new Node("A", NodeKind.HOST));
        network.addNode(new Node("B", NodeKind.HOST));
        network.addLink("A", "B");
        return network;
    }
}
