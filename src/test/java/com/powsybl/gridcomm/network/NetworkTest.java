/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network;

import com.powsybl.commons.PowsyblException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NetworkTest {

    private static void assertNoPortReferences(Network network, String linkId) {
        for (Node node : network.getNodes()) {
            for (Port port : node.getPorts()) {
                assertNotEquals(linkId, port.getLinkId());
            }
        }
    }

    @Test
    void defaultPorts() {
        assertEquals(1, new Node("h", NodeKind.HOST).getPorts().size());
        assertEquals(4, new Node("r", NodeKind.ROUTER).getPorts().size());
        assertEquals(8, new Node("s", NodeKind.SWITCH).getPorts().size());
        Node station = new Node("sta", NodeKind.STATION);
        assertEquals(1, station.getPorts().size());
        assertEquals(PortType.WIRELESS, station.getPorts().get(0).getType());
        assertEquals(2, new Node("ap", NodeKind.ACCESS_POINT).getPorts().size());
    }

    @Test
    void addLinkBindsPorts() {
        Network network = TwoHostNetworkFactory.create();
        Link link = network.getLinks().iterator().next();
        Node a = network.getNodeOrThrow("A");
        Node b = network.getNodeOrThrow("B");
        assertEquals(link.getId(), a.getPorts().get(0).getLinkId());
        assertEquals(link.getId(), b.getPorts().get(0).getLinkId());
        assertTrue(a.getAvailablePorts().isEmpty());
        assertEquals("B", link.getOtherNodeId("A"));
    }

    @Test
    void rejectSelfLinkAndBoundPort() {
        Network network = TwoHostNetworkFactory.create();
        network.addNode(new Node("C", NodeKind.HOST));
        Node c = network.getNodeOrThrow("C");
        String cPort = c.getPorts().get(0).getId();
        Link selfLink = new Link("self", new LinkEndpoint("C", cPort), new LinkEndpoint("C", cPort));
        assertThrows(PowsyblException.class, () -> network.addLink(selfLink));

        String aPort = network.getNodeOrThrow("A").getPorts().get(0).getId();
        Link onBoundPort = new Link("bound", new LinkEndpoint("A", aPort), new LinkEndpoint("C", cPort));
        PowsyblException e = assertThrows(PowsyblException.class, () -> network.addLink(onBoundPort));
        assertTrue(e.getMessage().contains("already bound"));
        assertNull(c.getPorts().get(0).getLinkId());

        Link missingPort = new Link("missing", new LinkEndpoint("C", cPort), new LinkEndpoint("B", "B-unknown"));
        assertThrows(PowsyblException.class, () -> network.addLink(missingPort));
        assertThrows(PowsyblException.class, () -> network.addLink("A", "C"));
    }

    @Test
    void removeNodeRemovesItsLinks() {
        Network network = LineNetworkFactory.create();
        assertEquals(3, network.getLinkCount());
        Link r1r2 = network.getLinksOf("R2").get(0);
        network.removeNode("R1");
        assertEquals(1, network.getLinkCount());
        assertFalse(network.hasNode("R1"));
        assertNull(network.getLink(r1r2.getId()));
        assertNoPortReferences(network, r1r2.getId());
        assertTrue(network.getLinks().stream().noneMatch(l -> l.touches("R1")));
    }

    @Test
    void removeLinkClearsAddresses() {
        Network network = new Network("n");
        network.addNode(new Node("A", NodeKind.HOST));
        network.addNode(new Node("B", NodeKind.HOST));
        Link link = network.addLink("A", "B");
        Port port = network.getNodeOrThrow("A").getPorts().get(0);
        assertEquals("10.0.1.1", port.getIpAddress());
        network.removeLink(link.getId());
        assertFalse(port.isBound());
        assertFalse(port.hasIpAddress());
    }

    @Test
    void switchSubnetAutoAddressing() {
        Network network = SwitchStarNetworkFactory.create();
        assertEquals("10.1.1.1", network.getNodeOrThrow("H1").getPorts().get(0).getIpAddress());
        assertEquals("10.1.1.2", network.getNodeOrThrow("H2").getPorts().get(0).getIpAddress());
        assertEquals("10.1.1.3", network.getNodeOrThrow("H3").getPorts().get(0).getIpAddress());
        assertTrue(network.getNodeOrThrow("S").getPorts().stream().noneMatch(Port::hasIpAddress));
    }

    @Test
    void copyIsIndependent() {
        Network network = TwoHostNetworkFactory.create();
        network.getMetadata().put("source", "test");
        Network copy = network.copy();
        copy.getNodeOrThrow("A").getPorts().get(0).setAddress("10.9.9.1", "255.255.255.0");
        copy.removeNode("B");
        assertFalse(network.getNodeOrThrow("A").getPorts().get(0).hasIpAddress());
        assertEquals(2, network.getNodeCount());
        assertEquals(1, network.getLinkCount());
        assertEquals("test", copy.getMetadata().get("source"));
    }

    @Test
    void todosAreDeduplicated() {
        Network network = new Network("n");
        NetworkIssue todo = new NetworkIssue("unsupported_link_type", "converter", "wifi");
        network.addTodo(todo);
        network.addTodo(new NetworkIssue("unsupported_link_type", "converter", "wifi"));
        network.addWarning(new NetworkIssue("warning", "parser", "w"));
        assertEquals(1, network.getTodos().size());
        assertEquals(1, network.getWarnings().size());
        assertEquals(todo, network.getTodos().get(0));
    }
}
