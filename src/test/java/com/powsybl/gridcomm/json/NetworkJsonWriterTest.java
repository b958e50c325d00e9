/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.powsybl.gridcomm.failure.FailureScenarios;
import com.powsybl.gridcomm.network.*;
import com.powsybl.gridcomm.network.grid.*;
import com.powsybl.gridcomm.simulation.TrafficFlow;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class NetworkJsonWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode write(Network network) throws IOException {
        StringWriter writer = new StringWriter();
        NetworkJsonWriter.writeJson(network, writer);
        return MAPPER.readTree(writer.toString());
    }

    @Test
    void plainNetwork() throws IOException {
        Network network = TwoHostNetworkFactory.create();
        Node a = network.getNodeOrThrow("A");
        a.setPosition(new Position(10, -20));
        a.setServer(true);
        a.setProperty("inferredRole", "host");
        Port port = a.getPorts().get(0);
        port.setAddress("10.1.1.1", "255.255.255.0");
        network.getMetadata().put("script_name", "first");
        network.addTrafficFlow(new TrafficFlow("f1", "A", "B").setDestinationAddress("10.1.1.2"));
        network.addTodo(new NetworkIssue("parse_error", "parser", "broken"));

        JsonNode json = write(network);
        assertEquals("two-hosts", json.get("id").asText());
        assertEquals(Network.SIMULATION_DURATION_DEFAULT_VALUE, json.get("simulationDuration").asDouble(), 0);
        assertEquals("first", json.get("metadata").get("script_name").asText());

        JsonNode nodeA = json.get("nodes").get(0);
        assertEquals("A", nodeA.get("id").asText());
        assertEquals("HOST", nodeA.get("kind").asText());
        assertEquals(10, nodeA.get("x").asDouble(), 0);
        assertEquals(-20, nodeA.get("y").asDouble(), 0);
        assertTrue(nodeA.get("server").asBoolean());
        assertEquals("host", nodeA.get("properties").get("inferredRole").asText());
        JsonNode portA = nodeA.get("ports").get(0);
        assertEquals(port.getId(), portA.get("id").asText());
        assertEquals("10.1.1.1", portA.get("ipAddress").asText());
        assertEquals("link1", portA.get("link").asText());
        JsonNode nodeB = json.get("nodes").get(1);
        assertFalse(nodeB.has("server"));
        assertFalse(nodeB.get("ports").get(0).has("ipAddress"));

        JsonNode link = json.get("links").get(0);
        assertEquals("link1", link.get("id").asText());
        assertEquals("A", link.get("source").get("node").asText());
        assertEquals("B", link.get("target").get("node").asText());
        assertEquals("POINT_TO_POINT", link.get("channel").asText());
        assertFalse(link.has("gridLinkType"));

        JsonNode flow = json.get("trafficFlows").get(0);
        assertEquals("f1", flow.get("id").asText());
        assertEquals("10.1.1.2", flow.get("destinationAddress").asText());
        assertFalse(flow.has("trafficClass"));

        assertFalse(json.has("failureScenario"));
        assertEquals(0, json.get("warnings").size());
        assertEquals("parse_error", json.get("todos").get(0).get("type").asText());
    }

    @Test
    void gridElementsAndFailureScenario() throws IOException {
        Network network = new Network("substation").setAutoAddressing(false);
        network.addNode(new GridNode("cc", GridNodeType.CONTROL_CENTER));
        network.addNode(new GridNode("rtu", GridNodeType.RTU));
        network.addLink("cc", "rtu", (id, source, target) -> new GridLink(id, source, target, GridLinkType.FIBER));
        network.addTrafficFlow(new GridTrafficFlow("poll", "cc", "rtu", GridTrafficClass.SCADA_INTEGRITY_POLL));
        network.setFailureScenario(FailureScenarios.singleLinkFailure("link1", 2.0, 3.0));

        JsonNode json = write(network);
        JsonNode controlCenter = json.get("nodes").get(0);
        assertEquals("CONTROL_CENTER", controlCenter.get("gridType").asText());
        assertEquals("MASTER", controlCenter.get("gridRole").asText());
        assertEquals("DNP3", controlCenter.get("protocol").asText());

        JsonNode link = json.get("links").get(0);
        assertEquals("FIBER", link.get("gridLinkType").asText());
        assertEquals("HIGH", link.get("reliabilityClass").asText());
        assertEquals("1Gbps", link.get("dataRate").asText());

        JsonNode flow = json.get("trafficFlows").get(0);
        assertEquals("SCADA_INTEGRITY_POLL", flow.get("trafficClass").asText());
        assertEquals(60000, flow.get("intervalMs").asInt());

        JsonNode scenario = json.get("failureScenario");
        assertEquals("link-failure-link1", scenario.get("id").asText());
        JsonNode event = scenario.get("events").get(0);
        assertEquals("LINK_DOWN", event.get("type").asText());
        assertEquals("link1", event.get("targets").get(0).asText());
        assertEquals(2.0, event.get("triggerTime").asDouble(), 0);
        assertEquals(3.0, event.get("duration").asDouble(), 0);
    }

    @Test
    void writeToFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("two-hosts.json");
        NetworkJsonWriter.writeJson(TwoHostNetworkFactory.create(), file);
        assertEquals("two-hosts", MAPPER.readTree(file.toFile()).get("id").asText());
    }
}
