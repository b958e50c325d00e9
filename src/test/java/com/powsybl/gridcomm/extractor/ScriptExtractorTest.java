/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridcomm.simulation.TrafficProtocol;
import com.powsybl.gridcomm.util.ReportNodeFactory;
import com.powsybl.gridcomm.util.Reports;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

class ScriptExtractorTest {

    private ScriptExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ScriptExtractor();
    }

    static String readScript(String name) {
        try (InputStream is = Objects.requireNonNull(ScriptExtractorTest.class.getResourceAsStream("/scripts/" + name))) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static List<String> keys(List<ReportNode> diagnostics) {
        return ReportNodeFactory.messageKeys(diagnostics);
    }

    @Test
    void pointToPointEcho() {
        ExtractionResult result = extractor.extract(readScript("first.py"), "first");
        assertTrue(result.isSuccess());
        assertTrue(result.getErrors().isEmpty());
        assertEquals("Two nodes joined by a point-to-point link, with a UDP echo exchange.", result.getDescription());
        assertEquals(11.0, result.getDuration(), 0);

        assertEquals(2, result.getNodes().size());
        assertEquals(2, result.getNodeCount("nodes"));
        assertTrue(result.getNodes().stream().allMatch(n -> n.getRole() == NodeRole.HOST && n.getMediumHint() == MediumHint.WIRED));

        assertEquals(1, result.getLinks().size());
        ExtractedLink link = result.getLinks().get(0);
        assertEquals(new NodeKey("nodes", 0), link.source());
        assertEquals(new NodeKey("nodes", 1), link.target());
        assertEquals(ChannelMedium.POINT_TO_POINT, link.medium());
        assertEquals("5Mbps", link.dataRate());
        assertEquals("2ms", link.delay());
        assertEquals("devices", link.deviceContainer());
        assertEquals(ChannelMedium.POINT_TO_POINT, result.getDeviceContainers().get("devices"));

        assertEquals(List.of(new ExtractedAddressAssignment("devices", "10.1.1.0", "255.255.255.0")),
                result.getAddressAssignments());

        assertEquals(2, result.getApplications().size());
        ExtractedApplication server = result.getApplications().get(0);
        assertEquals(ApplicationKind.UDP_ECHO_SERVER, server.getKind());
        assertEquals(new NodeKey("nodes", 1), server.getNode());
        assertEquals(9, server.getPort());
        assertEquals(1.0, server.getStartTime(), 0);
        assertEquals(10.0, server.getStopTime(), 0);
        ExtractedApplication client = result.getApplications().get(1);
        assertEquals(ApplicationKind.UDP_ECHO_CLIENT, client.getKind());
        assertEquals(new NodeKey("nodes", 0), client.getNode());
        assertEquals("10.1.1.2", client.getRemoteAddress());
        assertEquals(2.0, client.getStartTime(), 0);
    }

    @Test
    void loopInstallOnSwitch() {
        ExtractionResult result = extractor.extract(readScript("switch-star.py"), "switch-star");
        assertTrue(result.isSuccess());
        assertEquals("Four terminals attached to a single switch through dedicated CSMA links.", result.getDescription());
        assertEquals(5, result.getNodes().size());
        assertEquals(NodeRole.SWITCH, result.getNode(new NodeKey("switchNode", 0)).orElseThrow().getRole());
        assertEquals(4, result.getLinks().size());
        for (int i = 0; i < 4; i++) {
            ExtractedLink link = result.getLinks().get(i);
            assertEquals(new NodeKey("terminals", i), link.source());
            assertEquals(new NodeKey("switchNode", 0), link.target());
            assertEquals(ChannelMedium.CSMA, link.medium());
            assertEquals("100Mbps", link.dataRate());
        }
        assertEquals(20.0, result.getDuration(), 0);

        ExtractedApplication sink = result.getApplications().get(0);
        assertTrue(sink.isServer());
        assertEquals(TrafficProtocol.TCP, sink.getProtocol());
        assertEquals(5000, sink.getPort());
        ExtractedApplication onoff = result.getApplications().get(1);
        assertEquals(ApplicationKind.ON_OFF, onoff.getKind());
        assertEquals("10.1.1.4", onoff.getRemoteAddress());
        assertEquals("1Mbps", onoff.getDataRate());
        assertEquals(512, onoff.getPacketSize());
        assertEquals(1.0, onoff.getStartTime(), 0);
        assertEquals(9.0, onoff.getStopTime(), 0);
    }

    @Test
    void sharedMediumChain() {
        String source = String.join("\n",
                "lanNodes = ns.NodeContainer()",
                "lanNodes.Create(4)",
                "csma = ns.CsmaHelper()",
                "lanDevices = csma.Install(lanNodes)",
                "");
        ExtractionResult result = extractor.extract(source, "lan");
        assertEquals(3, result.getLinks().size());
        assertTrue(result.getLinks().stream().allMatch(l -> l.medium() == ChannelMedium.CSMA));
        assertEquals(new NodeKey("lanNodes", 2), result.getLinks().get(2).source());
        assertEquals(new NodeKey("lanNodes", 3), result.getLinks().get(2).target());
        assertEquals(ChannelMedium.CSMA, result.getDeviceContainers().get("lanDevices"));
    }

    @Test
    void wirelessContainers() {
        String source = String.join("\n",
                "wifiStaNodes = ns.NodeContainer()",
                "wifiStaNodes.Create(3)",
                "wifiApNode = ns.NodeContainer()",
                "wifiApNode.Create(1)",
                "wifi = ns.WifiHelper()",
                "staDevices = wifi.Install(phy, mac, wifiStaNodes)",
                "apDevices = wifi.Install(phy, mac, wifiApNode)",
                "");
        ExtractionResult result = extractor.extract(source, "wifi");
        assertTrue(result.isSuccess());
        assertEquals(2, result.getLinks().size());
        assertTrue(result.getLinks().stream().allMatch(l -> l.medium() == ChannelMedium.WIFI));
        assertEquals(MediumHint.WIFI_STATION, result.getNode(new NodeKey("wifiStaNodes", 1)).orElseThrow().getMediumHint());
        ExtractedNode accessPoint = result.getNode(new NodeKey("wifiApNode", 0)).orElseThrow();
        assertEquals(MediumHint.WIFI_AP, accessPoint.getMediumHint());
        assertEquals("isolated", accessPoint.getInferredRole());
    }

    @Test
    void hubOfDedicatedLinksBecomesRouter() {
        String source = String.join("\n",
                "hosts = ns.NodeContainer()",
                "hosts.Create(4)",
                "p2p = ns.PointToPointHelper()",
                "d1 = p2p.Install(hosts.Get(0), hosts.Get(1))",
                "d2 = p2p.Install(hosts.Get(0), hosts.Get(2))",
                "d3 = p2p.Install(hosts.Get(0), hosts.Get(3))",
                "");
        ExtractionResult result = extractor.extract(source, "hub");
        assertEquals(3, result.getLinks().size());
        assertEquals(NodeRole.ROUTER, result.getNode(new NodeKey("hosts", 0)).orElseThrow().getRole());
        assertEquals(NodeRole.HOST, result.getNode(new NodeKey("hosts", 1)).orElseThrow().getRole());
    }

    @Test
    void nodeCountFromVariableOrDefault() {
        ExtractionResult known = extractor.extract("n = 5\nnodes = ns.NodeContainer()\nnodes.Create(n)\n", "known");
        assertEquals(5, known.getNodes().size());
        assertFalse(keys(known.getWarnings()).contains("gridcomm.unknownNodeCount"));

        ExtractionResult unknown = extractor.extract("nodes = ns.NodeContainer()\nnodes.Create(int(sys.argv[1]))\n", "unknown");
        assertEquals(TopologyVisitor.CREATE_COUNT_DEFAULT_VALUE, unknown.getNodes().size());
        assertEquals(List.of("Could not determine node count for nodes.Create(), using default=3"),
                unknown.getWarnings().stream().map(ReportNode::getMessage).toList());
    }

    @Test
    void ambiguousInstallOfUnknownHelper() {
        String source = String.join("\n",
                "nodes = ns.NodeContainer()",
                "nodes.Create(3)",
                "helper = build()",
                "helper.Install(nodes)",
                "");
        ReportNode reportNode = ReportNodeFactory.create();
        ExtractionResult result = extractor.extract(source, "ambiguous", reportNode);
        assertEquals(2, result.getLinks().size());
        assertTrue(keys(result.getWarnings()).contains("gridcomm.unknownHelperInstall"));

        ReportNode extraction = reportNode.getChildren().get(0);
        assertEquals(Reports.EXTRACTION_KEY, extraction.getMessageKey());
        assertEquals("Extraction of ambiguous", extraction.getMessage());
        assertEquals("Install of unknown helper helper on container nodes treated as a shared medium chain",
                extraction.getChildren().get(0).getMessage());
    }

    @Test
    void syntaxErrorGivesFailedResult() {
        ExtractionResult result = extractor.extract("nodes = ns.NodeContainer()\nif nodes\n    pass\n", "broken");
        assertFalse(result.isSuccess());
        assertEquals(List.of("gridcomm.syntaxError"), keys(result.getErrors()));
        assertTrue(result.getErrors().get(0).getMessage().startsWith("Syntax error at line 2"));
        assertTrue(result.getNodes().isEmpty());
    }

    @Test
    void scriptWithoutTopology() {
        ExtractionResult result = extractor.extract("import sys\nprint('hello')\n", "hello");
        assertFalse(result.isSuccess());
        assertTrue(result.getErrors().isEmpty());
        assertEquals(List.of("gridcomm.noTopology"), keys(result.getWarnings()));
        assertEquals("No topology elements found", result.getWarnings().get(0).getMessage());
    }

    @Test
    void extractFromFile(@TempDir Path tempDir) throws IOException {
        Path examples = Files.createDirectories(tempDir.resolve("src").resolve("point-to-point").resolve("examples"));
        Path script = examples.resolve("first.py");
        Files.writeString(script, readScript("first.py"));
        ExtractionResult result = extractor.extract(script);
        assertTrue(result.isSuccess());
        assertEquals("first", result.getScriptName());
        assertEquals("point-to-point", result.getModuleName());
        assertEquals(script.toString(), result.getSourceFile());

        ExtractionResult missing = extractor.extract(examples.resolve("missing.py"));
        assertFalse(missing.isSuccess());
        assertEquals(List.of("gridcomm.readError"), keys(missing.getErrors()));
        assertTrue(missing.getErrors().get(0).getMessage().startsWith("Could not read file: "));
    }

    @Test
    void moduleNames() {
        assertEquals("wifi", ScriptExtractor.inferModuleName(Path.of("ns-3", "src", "wifi", "examples", "wifi-adhoc.py")));
        assertEquals("tutorial", ScriptExtractor.inferModuleName(Path.of("ns-3", "tutorial", "examples", "first.py")));
        assertEquals("", ScriptExtractor.inferModuleName(Path.of("first.py")));
    }

    @Test
    void descriptions() {
        assertEquals("One line.", ScriptExtractor.extractDescription("'''One line.'''\nx = 1\n"));
        assertEquals("Header comment", ScriptExtractor.extractDescription("# Header comment\nimport ns\nx = 1\n# ignored\n"));
        assertEquals("", ScriptExtractor.extractDescription("x = 1\n# too late\n"));
        String longDocstring = "\"\"\"" + "a".repeat(600) + "\"\"\"";
        assertEquals(500, ScriptExtractor.extractDescription(longDocstring).length());
    }
}
