/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

/**
 * Hosts and routers in a line, each pair joined by a dedicated link.
 */
public final class LineNetworkFactory {

    private LineNetworkFactory() {
    }

    /**
     *  H1 ---- R1 ---- R2 ---- H2
     *      l1      l2      l3
     */
    public static Network create() {
        Network network = new Network("line").setAutoAddressing(false);
        network.addNode(new Node("H1", NodeKind.HOST));
        network.addNode(new Node("R1", NodeKind.ROUTER));
        network.addNode(new Node("R2", NodeKind.ROUTER));
        network.addNode(new Node("H2", NodeKind.HOST));
        network.addLink("H1", "R1");
        network.addLink("R1", "R2");
        network.addLink("R2", "H2");
        return network;
    }
}
