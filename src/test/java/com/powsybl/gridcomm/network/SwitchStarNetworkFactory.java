/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

/**
 * One switch with hosts attached to it.
 */
public final class SwitchStarNetworkFactory {

    private SwitchStarNetworkFactory() {
    }

    /**
     *        H1
     *        |
     *  H2 -- S -- H3
     */
    public static Network create() {
        return create("10.1.1.0", true);
    }

    /**
     * @param subnetBase subnet base of the switch, may be null
     */
    public static Network create(String subnetBase, boolean autoAddressing) {
        Network network = new Network("switch-star").setAutoAddressing(autoAddressing);
        Node s = new Node("S", NodeKind.SWITCH);
        if (subnetBase != null) {
            s.setSubnetBase(subnetBase);
        }
        network.addNode(s);
        for (String hostId : new String[] {"H1", "H2", "H3"}) {
            network.addNode(new Node(hostId, NodeKind.HOST));
            network.addLink(hostId, "S");
        }
        return network;
    }
}
