/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.generator;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;
import com.powsybl.gridcomm.extractor.ast.PythonParser;
import com.powsybl.gridcomm.failure.FailureScenarios;
import com.powsybl.gridcomm.network.*;
import com.powsybl.gridcomm.simulation.SimulationConfig;
import com.powsybl.gridcomm.simulation.TrafficApplication;
import com.powsybl.gridcomm.simulation.TrafficFlow;
import com.powsybl.gridcomm.util.ReportNodeFactory;
import com.powsybl.gridcomm.util.Reports;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScriptGeneratorTest {

    private ScriptGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new ScriptGenerator();
    }

    private static void assertSectionsOnce(String script) {
        for (ScriptSection section : ScriptSection.values()) {
            assertEquals(1, StringUtils.countMatches(script, section.getMarker()), section.getTitle());
        }
        int previous = -1;
        for (ScriptSection section : ScriptSection.values()) {
            int index = script.indexOf(section.getMarker());
            assertTrue(index > previous, section.getTitle() + " is out of order");
            previous = index;
        }
    }

    private static List<String> keys(GenerationResult result) {
        return ReportNodeFactory.messageKeys(result.getDiagnostics());
    }

    @Test
    void twoHosts() {
        Network network = TwoHostNetworkFactory.create();
        GenerationResult result = generator.generate(network);
        String script = result.getScript();

        assertSectionsOnce(script);
        assertEquals(1, StringUtils.countMatches(script, "# Subnet "));
        assertTrue(script.contains("# Subnet 10.1.1.0/24"));
        assertTrue(script.contains("nodes.Create(2)"));
        assertTrue(script.contains("ipv4.SetBase(ns.Ipv4Address('10.1.1.0'), ns.Ipv4Mask('255.255.255.0'), ns.Ipv4Address('0.0.0.1'))"));
        assertTrue(script.contains("ipv4.SetBase(ns.Ipv4Address('10.1.1.0'), ns.Ipv4Mask('255.255.255.0'), ns.Ipv4Address('0.0.0.2'))"));
        assertTrue(script.contains("# No traffic flows"));
        assertTrue(script.contains("ns.Simulator.Stop(ns.Seconds(10.0))"));
        assertFalse(result.hasWarnings());
        assertFalse(result.hasErrors());
        assertDoesNotThrow(() -> PythonParser.parse(script));
    }

    @Test
    void generationDoesNotModifyNetwork() {
        Network network = TwoHostNetworkFactory.create();
        String first = generator.generate(network).getScript();
        for (Node node : network.getNodes()) {
            assertTrue(node.getPorts().stream().noneMatch(Port::hasIpAddress));
        }
        assertEquals(first, generator.generate(network).getScript());
    }

    @Test
    void switchIsBridged() {
        Network network = SwitchStarNetworkFactory.create();
        String script = generator.generate(network).getScript();

        assertSectionsOnce(script);
        assertTrue(script.contains("ns.CsmaHelper()"));
        assertTrue(script.contains("bridge0 = ns.BridgeHelper()"));
        assertTrue(script.contains("bridge0.Install(nodes.Get(0), bridge_devices0)"));
        assertEquals(1, StringUtils.countMatches(script, "# Subnet "));
        assertTrue(script.contains("# Subnet 10.1.1.0/24"));
        // switches get no internet stack
        assertFalse(script.contains("stack.Install(nodes.Get(0))"));
        assertTrue(script.contains("stack.Install(nodes.Get(1))"));
        assertDoesNotThrow(() -> PythonParser.parse(script));
    }

    @Test
    void echoFlow() {
        Network network = TwoHostNetworkFactory.create();
        network.addTrafficFlow(new TrafficFlow("f1", "A", "B").setApplication(TrafficApplication.ECHO));
        GenerationResult result = generator.generate(network);
        String script = result.getScript();

        assertTrue(script.contains("echo_server0 = ns.UdpEchoServerHelper(9000)"));
        assertTrue(script.contains("server_apps0 = echo_server0.Install(nodes.Get(1))"));
        assertTrue(script.contains("client_apps0 = echo_client0.Install(nodes.Get(0))"));
        assertTrue(script.contains("client_apps0.Start(ns.Seconds(1.0))"));
        assertFalse(result.hasWarnings());
        assertDoesNotThrow(() -> PythonParser.parse(script));
    }

    @Test
    void flowsOfConfigOverrideNetworkFlows() {
        Network network = TwoHostNetworkFactory.create();
        network.addTrafficFlow(new TrafficFlow("f1", "A", "B").setApplication(TrafficApplication.ECHO));
        SimulationConfig config = new SimulationConfig()
                .addFlow(new TrafficFlow("f2", "B", "A").setApplication(TrafficApplication.BULK_SEND));
        String script = generator.generate(network, config).getScript();
        assertFalse(script.contains("UdpEchoServerHelper"));
        assertTrue(script.contains("bulk0 = ns.BulkSendHelper"));
    }

    @Test
    void invalidFlowIsSkipped() {
        Network network = TwoHostNetworkFactory.create();
        network.addTrafficFlow(new TrafficFlow("f1", "A", "Z"));
        GenerationResult result = generator.generate(network);

        assertTrue(result.hasWarnings());
        assertEquals(List.of("gridcomm.flowEndpointMissing"), keys(result));
        assertEquals("Flow 'f1' skipped: node 'Z' does not exist", result.getDiagnostics().get(0).getMessage());
        assertTrue(result.getScript().contains("# WARN gridcomm.flowEndpointMissing: Flow 'f1' skipped"));
        assertTrue(result.getScript().contains("# Flow 0 (f1) skipped"));
        assertSectionsOnce(result.getScript());
    }

    @Test
    void multipleRoutersOnSegment() {
        Network network = SwitchStarNetworkFactory.create();
        network.addNode(new Node("R1", NodeKind.ROUTER));
        network.addNode(new Node("R2", NodeKind.ROUTER));
        network.addLink("R1", "S");
        network.addLink("R2", "S");
        GenerationResult result = generator.generate(network);
        String script = result.getScript();

        assertTrue(keys(result).contains("gridcomm.multipleRoutersOnSegment"));
        assertTrue(script.contains("static_routing = ns.Ipv4StaticRoutingHelper()"));
        assertFalse(script.contains("PopulateRoutingTables"));
        assertTrue(script.contains("SetDefaultRoute(ns.Ipv4Address('10.1.1.4')"));
    }

    @Test
    void failureScenarioIsListed() {
        Network network = LineNetworkFactory.create();
        network.setFailureScenario(FailureScenarios.singleLinkFailure("link2", 2.0, 3.0));
        String script = generator.generate(network).getScript();

        assertTrue(script.contains("# Scenario Single Link Failure - link2: 1 events over 5.0 s"));
        assertTrue(script.contains("#   t=2.0s LINK_DOWN on LINK link2, recovers at t=5.0s"));
        assertDoesNotThrow(() -> PythonParser.parse(script));
    }

    @Test
    void tracingFollowsConfig() {
        Network network = TwoHostNetworkFactory.create();
        SimulationConfig config = new SimulationConfig()
                .setEnablePcap(true)
                .setEnableAsciiTrace(false)
                .setEnableFlowMonitor(false)
                .setDuration(20);
        String script = new ScriptGenerator(new GenerationParameters().setOutputDirectory("/tmp/out"))
                .generate(network, config)
                .getScript();
        assertTrue(script.contains("p2p_trace.EnablePcapAll('/tmp/out/capture')"));
        assertFalse(script.contains("AsciiTraceHelper"));
        assertFalse(script.contains("FlowMonitorHelper"));
        assertTrue(script.contains("ns.Simulator.Stop(ns.Seconds(20.0))"));
    }

    @Test
    void reportsAreAddedUnderCallerNode() {
        Network network = TwoHostNetworkFactory.create();
        network.addTrafficFlow(new TrafficFlow("f1", "A", "Z"));
        ReportNode reportNode = ReportNodeFactory.create();
        GenerationResult result = generator.generate(network, new SimulationConfig(), null, reportNode);

        ReportNode generation = reportNode.getChildren().get(0);
        assertSame(generation, result.getReportNode());
        assertEquals(Reports.SCRIPT_GENERATION_KEY, generation.getMessageKey());
        assertEquals(Reports.ADDRESS_RESOLUTION_KEY, generation.getChildren().get(0).getMessageKey());
        assertEquals(1, Reports.getDiagnostics(reportNode, TypedValue.WARN_SEVERITY).size());
    }

    @Test
    void olsrRoutersGetListRoutingStack() {
        Network network = LineNetworkFactory.create();
        network.getNodeOrThrow("R1").setRoutingProtocol("olsr");
        network.getNodeOrThrow("R2").setRoutingProtocol("OLSR");
        GenerationResult result = generator.generate(network);
        String script = result.getScript();

        assertTrue(script.contains("olsr = ns.OlsrHelper()"));
        assertTrue(script.contains("olsr_static_routing = ns.Ipv4StaticRoutingHelper()"));
        assertTrue(script.contains("olsr_list_routing = ns.Ipv4ListRoutingHelper()"));
        assertTrue(script.contains("olsr_list_routing.Add(olsr_static_routing, 0)"));
        assertTrue(script.contains("olsr_list_routing.Add(olsr, 10)"));
        assertTrue(script.contains("olsr_stack.SetRoutingHelper(olsr_list_routing)"));
        assertTrue(script.contains("olsr_nodes.Add(nodes.Get(1))"));
        assertTrue(script.contains("olsr_nodes.Add(nodes.Get(2))"));
        assertTrue(script.contains("olsr_stack.Install(olsr_nodes)"));
        // hosts keep the default stack and global routing
        assertTrue(script.contains("stack.Install(nodes.Get(0))"));
        assertTrue(script.contains("stack.Install(nodes.Get(3))"));
        assertFalse(script.contains(" stack.Install(nodes.Get(1))"));
        assertTrue(script.contains("# OLSR routes "));
        assertTrue(script.contains("ns.Ipv4GlobalRoutingHelper.PopulateRoutingTables()"));
        assertTrue(script.indexOf("olsr_stack.Install(olsr_nodes)") < script.indexOf("ipv4 = ns.Ipv4AddressHelper()"));
        assertFalse(result.hasWarnings());
        assertSectionsOnce(script);
        assertDoesNotThrow(() -> PythonParser.parse(script));
    }

    @Test
    void aodvOnlyNetworkSkipsGlobalRouting() {
        Network network = TwoHostNetworkFactory.create();
        network.getNodes().forEach(node -> node.setRoutingProtocol("aodv"));
        GenerationResult result = generator.generate(network);
        String script = result.getScript();

        assertTrue(script.contains("aodv = ns.AodvHelper()"));
        assertTrue(script.contains("aodv_list_routing.Add(aodv, 10)"));
        assertTrue(script.contains("aodv_nodes.Add(nodes.Get(0))"));
        assertTrue(script.contains("aodv_nodes.Add(nodes.Get(1))"));
        assertFalse(script.contains(" stack.Install(nodes.Get("));
        assertFalse(script.contains("PopulateRoutingTables"));
        assertTrue(script.contains("print('Routing tables built by dynamic routing protocols')"));
        assertFalse(result.hasWarnings());
        assertDoesNotThrow(() -> PythonParser.parse(script));
    }

    @Test
    void ripRoutersGetListRoutingStack() {
        Network network = LineNetworkFactory.create();
        network.getNodeOrThrow("R1").setRoutingProtocol("rip");
        network.getNodeOrThrow("R2").setRoutingProtocol("rip");
        GenerationResult result = generator.generate(network);
        String script = result.getScript();

        assertTrue(script.contains("rip = ns.RipHelper()"));
        assertTrue(script.contains("rip_list_routing.Add(rip_static_routing, 0)"));
        assertTrue(script.contains("rip_list_routing.Add(rip, 10)"));
        assertTrue(script.contains("rip_nodes.Add(nodes.Get(1))"));
        assertTrue(script.contains("rip_nodes.Add(nodes.Get(2))"));
        assertTrue(script.contains("rip_stack.Install(rip_nodes)"));
        assertFalse(script.contains("OlsrHelper"));
        assertFalse(result.hasWarnings());
        assertDoesNotThrow(() -> PythonParser.parse(script));
    }

    @Test
    void unknownRoutingProtocolFallsBackToStatic() {
        Network network = LineNetworkFactory.create();
        network.getNodeOrThrow("R1").setRoutingProtocol("ospf");
        GenerationResult result = generator.generate(network);
        String script = result.getScript();

        assertEquals(List.of("gridcomm.unsupportedRoutingProtocol"), keys(result));
        assertEquals("Routing protocol 'ospf' of node 'R1' is replaced by static routing",
                result.getDiagnostics().get(0).getMessage());
        assertTrue(script.contains("stack.Install(nodes.Get(1))"));
        assertTrue(script.contains("ns.Ipv4GlobalRoutingHelper.PopulateRoutingTables()"));
        assertTrue(result.hasWarnings());
        assertFalse(result.hasErrors());
    }
}
