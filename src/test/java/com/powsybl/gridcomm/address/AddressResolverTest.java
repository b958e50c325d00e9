/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.address;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridcomm.network.*;
import com.powsybl.gridcomm.util.Ipv4Addresses;
import com.powsybl.gridcomm.util.ReportNodeFactory;
import com.powsybl.gridcomm.util.Reports;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AddressResolverTest {

    private static String address(Network network, String nodeId) {
        return network.getNodeOrThrow(nodeId).getPorts().get(0).getIpAddress();
    }

    private static String address(Network network, Link link, LinkSide side) {
        return AddressPolicy.getEndpointAddress(network, link, side).orElseThrow();
    }

    @Test
    void dedicatedLinksGetDistinctSubnets() {
        Network network = LineNetworkFactory.create();
        ReportNode reportNode = ReportNodeFactory.create();
        AddressResolution resolution = new AddressResolver().resolve(network, reportNode);

        Set<String> addresses = new HashSet<>();
        Set<String> subnets = new HashSet<>();
        for (Link link : network.getLinks()) {
            String source = address(network, link, LinkSide.SOURCE);
            String target = address(network, link, LinkSide.TARGET);
            assertTrue(addresses.add(source));
            assertTrue(addresses.add(target));
            String subnet = Ipv4Addresses.subnet24(source);
            assertEquals(subnet, Ipv4Addresses.subnet24(target));
            assertTrue(subnets.add(subnet));
            assertEquals(subnet, resolution.getSubnet(link.getId()).orElseThrow());
        }
        assertEquals(List.of("10.1.1.0", "10.1.2.0", "10.1.3.0"), resolution.getSubnets());
        assertEquals("10.1.1.1", address(network, "H1"));
        assertTrue(Reports.getDiagnostics(reportNode).isEmpty());
    }

    @Test
    void switchSegmentUsesSubnetBase() {
        Network network = SwitchStarNetworkFactory.create("10.1.1.0", false);
        AddressResolution resolution = new AddressResolver().resolve(network);

        assertEquals("10.1.1.1", address(network, "H1"));
        assertEquals("10.1.1.2", address(network, "H2"));
        assertEquals("10.1.1.3", address(network, "H3"));
        assertTrue(network.getNodeOrThrow("S").getPorts().stream().noneMatch(Port::hasIpAddress));

        Segment segment = resolution.getSwitchSegment("S").orElseThrow();
        assertEquals(Segment.Kind.SWITCH, segment.kind());
        assertEquals("10.1.1.0", segment.subnet());
        assertEquals(List.of("H1", "H2", "H3"), segment.members().stream().map(SegmentMember::nodeId).toList());
    }

    @Test
    void switchSegmentWithoutSubnetBase() {
        Network network = SwitchStarNetworkFactory.create(null, false);
        network.addNode(new Node("R", NodeKind.ROUTER));
        network.addNode(new Node("H4", NodeKind.HOST));
        network.addLink("R", "H4");
        AddressResolution resolution = new AddressResolver().resolve(network);

        String subnet = Ipv4Addresses.subnet24(address(network, "H1"));
        assertEquals(subnet, Ipv4Addresses.subnet24(address(network, "H2")));
        assertEquals(subnet, Ipv4Addresses.subnet24(address(network, "H3")));
        assertNotEquals(subnet, Ipv4Addresses.subnet24(address(network, "H4")));
        assertEquals(2, resolution.getSubnets().size());
    }

    @Test
    void configuredAddressesAreKept() {
        Network network = LineNetworkFactory.create();
        network.getNodeOrThrow("H1").getPorts().get(0).setAddress("10.1.1.7", Ipv4Addresses.NETMASK_24);
        new AddressResolver().resolve(network);

        assertEquals("10.1.1.7", address(network, "H1"));
        Link first = network.getLinksOf("H1").get(0);
        assertEquals("10.1.1.1", address(network, first, LinkSide.TARGET));
        Link second = network.getLinksOf("R2").get(0);
        assertEquals("10.1.2.0", Ipv4Addresses.subnet24(address(network, second, LinkSide.SOURCE)));
    }

    @Test
    void duplicateAndSwitchAddressesAreReported() {
        Network network = SwitchStarNetworkFactory.create("10.1.1.0", true);
        network.getNodeOrThrow("H2").getPorts().get(0).setAddress("10.1.1.1", Ipv4Addresses.NETMASK_24);
        network.getNodeOrThrow("S").getPorts().get(7).setAddress("10.1.1.254", Ipv4Addresses.NETMASK_24);
        ReportNode reportNode = ReportNodeFactory.create();
        new AddressResolver().resolve(network, reportNode);

        List<ReportNode> diagnostics = Reports.getDiagnostics(reportNode);
        List<String> keys = ReportNodeFactory.messageKeys(diagnostics);
        assertTrue(keys.contains("gridcomm.duplicateAddress"));
        assertTrue(keys.contains("gridcomm.switchPortAddress"));
        assertTrue(diagnostics.stream().anyMatch(d -> d.getMessage().equals("Address 10.1.1.1 is configured on ports "
                + network.getNodeOrThrow("H1").getPorts().get(0).getId() + ", "
                + network.getNodeOrThrow("H2").getPorts().get(0).getId())));
        assertEquals(Reports.ADDRESS_RESOLUTION_KEY, reportNode.getChildren().get(0).getMessageKey());
    }

    private static Network createTwoSwitchNetwork(String firstBase, String secondBase) {
        Network network = new Network("two-switches").setAutoAddressing(false);
        Node s1 = new Node("S1", NodeKind.SWITCH);
        Node s2 = new Node("S2", NodeKind.SWITCH);
        if (firstBase != null) {
            s1.setSubnetBase(firstBase);
        }
        if (secondBase != null) {
            s2.setSubnetBase(secondBase);
        }
        network.addNode(s1);
        for (String hostId : new String[] {"A", "B"}) {
            network.addNode(new Node(hostId, NodeKind.HOST));
            network.addLink(hostId, "S1");
        }
        network.addNode(s2);
        for (String hostId : new String[] {"C", "D"}) {
            network.addNode(new Node(hostId, NodeKind.HOST));
            network.addLink(hostId, "S2");
        }
        return network;
    }

    @Test
    void unbasedSegmentAvoidsLaterSubnetBase() {
        Network network = createTwoSwitchNetwork(null, "10.1.1.0");
        ReportNode reportNode = ReportNodeFactory.create();
        AddressResolution resolution = new AddressResolver().resolve(network, reportNode);

        String first = Ipv4Addresses.subnet24(address(network, "A"));
        assertEquals(first, Ipv4Addresses.subnet24(address(network, "B")));
        assertEquals("10.1.1.0", Ipv4Addresses.subnet24(address(network, "C")));
        assertEquals("10.1.1.0", Ipv4Addresses.subnet24(address(network, "D")));
        assertNotEquals(Ipv4Addresses.subnet24(address(network, "A")), Ipv4Addresses.subnet24(address(network, "C")));
        assertEquals("10.1.2.0", first);
        assertEquals(List.of("10.1.2.0", "10.1.1.0"), resolution.getSubnets());
        assertTrue(Reports.getDiagnostics(reportNode).isEmpty());
    }

    @Test
    void mixedBasedAndUnbasedSegments() {
        Network network = createTwoSwitchNetwork("10.1.3.0", null);
        AddressResolution resolution = new AddressResolver().resolve(network);

        assertEquals("10.1.3.1", address(network, "A"));
        assertEquals("10.1.3.2", address(network, "B"));
        assertEquals("10.1.1.1", address(network, "C"));
        assertEquals("10.1.1.2", address(network, "D"));
        assertEquals("10.1.3.0", resolution.getSwitchSegment("S1").orElseThrow().subnet());
        assertEquals("10.1.1.0", resolution.getSwitchSegment("S2").orElseThrow().subnet());
    }

    @Test
    void sharedSubnetBaseIsReported() {
        Network network = createTwoSwitchNetwork("10.1.5.0", "10.1.5.0");
        ReportNode reportNode = ReportNodeFactory.create();
        new AddressResolver().resolve(network, reportNode);

        Set<String> addresses = new HashSet<>();
        for (String hostId : new String[] {"A", "B", "C", "D"}) {
            assertTrue(addresses.add(address(network, hostId)));
        }
        List<ReportNode> diagnostics = Reports.getDiagnostics(reportNode);
        assertEquals(List.of("gridcomm.subnetCollision"), ReportNodeFactory.messageKeys(diagnostics));
        assertEquals("Subnet 10.1.5.0 of switch 'S2' is already used by another segment", diagnostics.get(0).getMessage());
    }

    @Test
    void reserveSubnetTellsWhetherSubnetWasFree() {
        SubnetAllocator allocator = new SubnetAllocator();
        assertTrue(allocator.reserveSubnet("10.1.1.0"));
        assertFalse(allocator.reserveSubnet("10.1.1.0"));
        assertEquals("10.1.2.0", allocator.nextSubnet());
    }

    @Test
    void allocatorSkipsReservedSubnets() {
        SubnetAllocator allocator = new SubnetAllocator();
        allocator.reserveAddress("10.1.1.5");
        assertEquals("10.1.2.0", allocator.nextSubnet());
        assertEquals("10.1.1.1", allocator.nextHost("10.1.1.0"));
        assertEquals("10.1.1.2", allocator.nextHost("10.1.1.0"));
        assertEquals("10.1.1.6", nextHostAfter(allocator, "10.1.1.0", 3));
    }

    private static String nextHostAfter(SubnetAllocator allocator, String subnet, int count) {
        String address = null;
        for (int i = 0; i < count; i++) {
            address = allocator.nextHost(subnet);
        }
        return address;
    }
}
