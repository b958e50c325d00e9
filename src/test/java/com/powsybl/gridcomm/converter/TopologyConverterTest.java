/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.converter;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridcomm.address.AddressPolicy;
import com.powsybl.gridcomm.extractor.*;
import com.powsybl.gridcomm.json.NetworkJsonWriter;
import com.powsybl.gridcomm.network.*;
import com.powsybl.gridcomm.simulation.TrafficApplication;
import com.powsybl.gridcomm.simulation.TrafficFlow;
import com.powsybl.gridcomm.util.Ipv4Addresses;
import com.powsybl.gridcomm.util.ReportNodeFactory;
import com.powsybl.gridcomm.util.Reports;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TopologyConverterTest {

    private ScriptExtractor extractor;

    private TopologyConverter converter;

    @BeforeEach
    void setUp() {
        extractor = new ScriptExtractor();
        converter = new TopologyConverter();
    }

    private ExtractionResult extractScript(String name) {
        try (InputStream is = Objects.requireNonNull(getClass().getResourceAsStream("/scripts/" + name + ".py"))) {
            return extractor.extract(new String(is.readAllBytes(), StandardCharsets.UTF_8), name);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String address(Network network, Link link, LinkSide side) {
        return AddressPolicy.getEndpointAddress(network, link, side).orElseThrow();
    }

    private static List<String> issueTypes(List<NetworkIssue> issues) {
        return issues.stream().map(NetworkIssue::type).collect(Collectors.toList());
    }

    private static String toJson(Network network) {
        StringWriter writer = new StringWriter();
        NetworkJsonWriter.writeJson(network, writer);
        return writer.toString();
    }

    @Test
    void pointToPointEcho() {
        Network network = converter.convert(extractScript("first"));
        assertEquals("first", network.getId());
        assertFalse(network.isAutoAddressing());
        assertEquals(11.0, network.getSimulationDuration(), 0);
        assertEquals("first", network.getMetadata().get("script_name"));
        assertEquals("11.0", network.getMetadata().get("original_duration"));

        assertEquals(2, network.getNodeCount());
        Node n1 = network.getNodeOrThrow("n1");
        Node n2 = network.getNodeOrThrow("n2");
        assertEquals("nodes_0", n1.getName());
        assertEquals("From container 'nodes' index 1", n2.getDescription());
        assertEquals(NodeKind.HOST, n1.getKind());
        assertTrue(n2.isServer());
        assertFalse(n1.isServer());

        Link link = network.getLink("l1");
        assertEquals(ChannelKind.POINT_TO_POINT, link.getChannel());
        assertEquals("5Mbps", link.getDataRate());
        assertEquals("2ms", link.getDelay());
        assertEquals("10.1.1.1", address(network, link, LinkSide.SOURCE));
        assertEquals("10.1.1.2", address(network, link, LinkSide.TARGET));

        assertEquals(1, network.getTrafficFlows().size());
        TrafficFlow flow = network.getTrafficFlows().get(0);
        assertEquals("f1", flow.getId());
        assertEquals("n1", flow.getSourceNodeId());
        assertEquals("n2", flow.getTargetNodeId());
        assertEquals(TrafficApplication.ECHO, flow.getApplication());
        assertEquals(9, flow.getPort());
        assertEquals(2.0, flow.getStartTime(), 0);
        assertEquals(10.0, flow.getStopTime(), 0);
        assertEquals(TrafficFlow.DATA_RATE_DEFAULT_VALUE, flow.getDataRate());
        assertTrue(network.getWarnings().isEmpty());
    }

    @Test
    void conversionIsDeterministic() {
        ExtractionResult extraction = extractScript("switch-star");
        assertEquals(toJson(converter.convert(extraction)), toJson(converter.convert(extraction)));
    }

    @Test
    void existingSwitchIsReused() {
        Network network = converter.convert(extractScript("switch-star"));
        assertEquals(5, network.getNodeCount());
        assertEquals(4, network.getLinkCount());
        Node hub = network.getNodeOrThrow("n5");
        assertTrue(hub.isSwitch());
        assertEquals("switch", hub.getProperty(TopologyConverter.INFERRED_ROLE_PROPERTY));
        assertEquals("host", network.getNodeOrThrow("n1").getProperty(TopologyConverter.INFERRED_ROLE_PROPERTY));

        Set<String> addresses = new HashSet<>();
        for (Link link : network.getLinks()) {
            assertEquals(ChannelKind.CSMA, link.getChannel());
            assertEquals("n5", link.getTargetNodeId());
            String address = address(network, link, LinkSide.SOURCE);
            assertTrue(address.startsWith("10.1.1."));
            addresses.add(address);
        }
        assertEquals(4, addresses.size());

        // terminals on a line, the switch below their center
        assertEquals(0, hub.getPosition().x(), 1e-9);
        assertEquals(0, hub.getPosition().y(), 1e-9);
        assertEquals(-225, network.getNodeOrThrow("n1").getPosition().x(), 1e-9);

        TrafficFlow flow = network.getTrafficFlows().get(0);
        assertEquals(TrafficApplication.ONOFF, flow.getApplication());
        assertEquals("1Mbps", flow.getDataRate());
        assertEquals(512, flow.getPacketSize());
        assertEquals(9.0, flow.getStopTime(), 0);
        assertEquals("10.1.1.4", flow.getDestinationAddress());
        assertTrue(network.getNodeOrThrow("n4").isServer());
    }

    @Test
    void sharedMediumLinkBetweenSwitchesIsKept() {
        ExtractionResult extraction = new ExtractionResult("trunk.py").setScriptName("trunk");
        NodeKey switchA = new NodeKey("switchA", 0);
        NodeKey switchB = new NodeKey("switchB", 0);
        NodeKey hostA = new NodeKey("hostsA", 0);
        NodeKey hostB = new NodeKey("hostsB", 0);
        extraction.getNodes().add(new ExtractedNode("switchA", 0, NodeRole.SWITCH, MediumHint.WIRED));
        extraction.getNodes().add(new ExtractedNode("switchB", 0, NodeRole.SWITCH, MediumHint.WIRED));
        extraction.getNodes().add(new ExtractedNode("hostsA", 0, NodeRole.HOST, MediumHint.WIRED));
        extraction.getNodes().add(new ExtractedNode("hostsB", 0, NodeRole.HOST, MediumHint.WIRED));
        extraction.getLinks().add(new ExtractedLink(hostA, switchA, ChannelMedium.CSMA, "", "", "csma", "lanA"));
        extraction.getLinks().add(new ExtractedLink(hostB, switchB, ChannelMedium.CSMA, "", "", "csma", "lanB"));
        extraction.getLinks().add(new ExtractedLink(switchA, switchB, ChannelMedium.CSMA, "", "", "csma", "trunk"));

        ReportNode reportNode = ReportNodeFactory.create();
        Network network = converter.convert(extraction, reportNode);
        assertEquals(4, network.getNodeCount());
        assertEquals(3, network.getLinkCount());

        Link trunk = network.getLink("l3");
        assertEquals(ChannelKind.CSMA, trunk.getChannel());
        assertEquals("n1", trunk.getSourceNodeId());
        assertEquals("n2", trunk.getTargetNodeId());
        assertEquals(TopologyConverter.SHARED_MEDIUM_DATA_RATE, trunk.getDataRate());
        assertTrue(AddressPolicy.isSwitchToSwitch(network, trunk));
        assertNotEquals(Ipv4Addresses.subnet24(address(network, network.getLink("l1"), LinkSide.SOURCE)),
                Ipv4Addresses.subnet24(address(network, network.getLink("l2"), LinkSide.SOURCE)));

        ReportNode conversion = reportNode.getChildren().get(0);
        assertEquals(Reports.CONVERSION_KEY, conversion.getMessageKey());
        List<ReportNode> diagnostics = Reports.getDiagnostics(reportNode);
        assertEquals(List.of("gridcomm.switchTrunkLink"), ReportNodeFactory.messageKeys(diagnostics));
        assertEquals("Shared medium link between switches 'switchA_0' and 'switchB_0' kept as a bridged trunk",
                diagnostics.get(0).getMessage());
    }

    @Test
    void sharedMediumChainGetsVirtualHub() {
        ExtractionResult extraction = extractor.extract(String.join("\n",
                "lanNodes = ns.NodeContainer()",
                "lanNodes.Create(4)",
                "csma = ns.CsmaHelper()",
                "lanDevices = csma.Install(lanNodes)",
                ""), "lan");
        Network network = converter.convert(extraction);
        assertEquals(5, network.getNodeCount());
        Node hub = network.getNodeOrThrow("n5");
        assertTrue(hub.isSwitch());
        assertEquals("csma_hub_csma_lanNodes", hub.getName());
        assertEquals("Virtual hub of the shared medium segment 'csma_lanNodes'", hub.getDescription());
        assertEquals(4, network.getLinkCount());
        for (Link link : network.getLinks()) {
            assertTrue(link.touches("n5"));
            assertEquals(TopologyConverter.SHARED_MEDIUM_DATA_RATE, link.getDataRate());
            assertEquals(TopologyConverter.LINK_DELAY, link.getDelay());
        }
    }

    @Test
    void twoMemberSegmentStaysDirect() {
        ExtractionResult extraction = extractor.extract(String.join("\n",
                "pair = ns.NodeContainer()",
                "pair.Create(2)",
                "csma = ns.CsmaHelper()",
                "csma.Install(pair)",
                ""), "pair");
        Network network = converter.convert(extraction);
        assertEquals(2, network.getNodeCount());
        Link link = network.getLink("l1");
        assertEquals(ChannelKind.CSMA, link.getChannel());
        assertEquals("n1", link.getSourceNodeId());
        assertEquals("n2", link.getTargetNodeId());
        assertEquals("10.1.1.1", address(network, link, LinkSide.SOURCE));
    }

    @Test
    void unsupportedMediumFallsBackToPointToPoint() {
        ExtractionResult extraction = extractor.extract(String.join("\n",
                "wifiStaNodes = ns.NodeContainer()",
                "wifiStaNodes.Create(3)",
                "wifi = ns.WifiHelper()",
                "wifi.Install(phy, mac, wifiStaNodes)",
                ""), "wifi");
        Network network = converter.convert(extraction);
        assertEquals(2, network.getLinkCount());
        assertTrue(network.getLinks().stream().allMatch(l -> l.getChannel() == ChannelKind.POINT_TO_POINT));
        assertEquals(MediumType.WIFI_STATION, network.getNodeOrThrow("n1").getMedium());
        assertEquals(List.of("unsupported_link_type"), issueTypes(network.getTodos()));
    }

    @Test
    void invalidLinksAndExtractionIssues() {
        ExtractionResult extraction = new ExtractionResult("manual.py").setScriptName("");
        extraction.getNodes().add(new ExtractedNode("hosts", 0, NodeRole.HOST, MediumHint.WIRED));
        extraction.getNodes().add(new ExtractedNode("hosts", 1, NodeRole.HOST, MediumHint.WIRED));
        extraction.getNodes().add(new ExtractedNode("hosts", 1, NodeRole.HOST, MediumHint.WIRED));
        NodeKey h0 = new NodeKey("hosts", 0);
        NodeKey h1 = new NodeKey("hosts", 1);
        extraction.getLinks().add(new ExtractedLink(h0, h1, ChannelMedium.POINT_TO_POINT, "", "", "p2p", ""));
        extraction.getLinks().add(new ExtractedLink(h0, new NodeKey("ghosts", 0), ChannelMedium.POINT_TO_POINT, "", "", "p2p", ""));
        extraction.getLinks().add(new ExtractedLink(h1, h1, ChannelMedium.POINT_TO_POINT, "", "", "p2p", ""));
        Reports.reportEmptyInstall(extraction.getReportNode(), "p2p", "hosts");
        Reports.reportSyntaxError(extraction.getReportNode(), 3, "broken");
        ExtractedApplication client = new ExtractedApplication(ApplicationKind.ON_OFF, h0, "onoff")
                .setRemoteAddress("10.9.9.9");
        extraction.getApplications().add(client);
        extraction.getApplications().add(new ExtractedApplication(ApplicationKind.BULK_SEND, new NodeKey("ghosts", 0), "bulk"));

        Network network = converter.convert(extraction);
        assertEquals("imported", network.getId());
        assertEquals(2, network.getNodeCount());
        assertEquals(1, network.getLinkCount());
        Link link = network.getLink("l1");
        assertEquals(TopologyConverter.DIRECT_DATA_RATE, link.getDataRate());
        assertEquals(TopologyConverter.LINK_DELAY, link.getDelay());
        assertEquals(List.of("parser_warning", "unknown_node", "self_link", "unresolved_flow_target", "unknown_node"),
                issueTypes(network.getWarnings()));
        assertEquals(List.of("parse_error"), issueTypes(network.getTodos()));
        assertEquals("Syntax error at line 3: broken", network.getTodos().get(0).message());

        TrafficFlow flow = network.getTrafficFlows().get(0);
        assertEquals("", flow.getTargetNodeId());
        assertEquals("10.9.9.9", flow.getDestinationAddress());
        assertEquals(network.getSimulationDuration(), flow.getStopTime(), 0);
    }

    @Test
    void manyNodesAreLaidOutOnACircle() {
        ExtractionResult extraction = extractor.extract("hosts = ns.NodeContainer()\nhosts.Create(6)\n", "ring");
        Network network = converter.convert(extraction);
        double radius = 6 * ConverterParameters.NODE_SPACING_DEFAULT_VALUE / (2 * Math.PI);
        Position first = network.getNodeOrThrow("n1").getPosition();
        assertEquals(0, first.x(), 1e-9);
        assertEquals(-radius, first.y(), 1e-9);
        for (Node node : network.getNodes()) {
            Position p = node.getPosition();
            assertEquals(radius, Math.hypot(p.x(), p.y()), 1e-9);
            assertEquals("isolated", node.getProperty(TopologyConverter.INFERRED_ROLE_PROPERTY));
        }
    }
}
