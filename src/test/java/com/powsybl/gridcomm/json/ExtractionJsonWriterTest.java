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
import com.powsybl.gridcomm.extractor.ExtractionResult;
import com.powsybl.gridcomm.extractor.ScriptExtractor;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionJsonWriterTest {

    private static final String SCRIPT = String.join("\n",
            "# Two hosts",
            "nodes = ns.NodeContainer()",
            "nodes.Create(2)",
            "p2p = ns.PointToPointHelper()",
            "p2p.SetDeviceAttribute(\"DataRate\", ns.StringValue(\"5Mbps\"))",
            "devices = p2p.Install(nodes)",
            "address = ns.Ipv4AddressHelper()",
            "address.SetBase(\"10.1.1.0\", \"255.255.255.0\")",
            "interfaces = address.Assign(devices)",
            "sink = ns.PacketSinkHelper(\"ns3::UdpSocketFactory\", ns.InetSocketAddress(ns.Ipv4Address.GetAny(), 4000))",
            "apps = sink.Install(nodes.Get(1))",
            "apps.Start(ns.Seconds(0.5))",
            "");

    private static JsonNode write(ExtractionResult extraction) throws IOException {
        StringWriter writer = new StringWriter();
        ExtractionJsonWriter.writeJson(extraction, writer, Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
        return new ObjectMapper().readTree(writer.toString());
    }

    @Test
    void sections() throws IOException {
        JsonNode json = write(new ScriptExtractor().extract(SCRIPT, "two-hosts"));

        JsonNode info = json.get("extraction_info");
        assertEquals("two-hosts", info.get("script_name").asText());
        assertEquals("Two hosts", info.get("description").asText());
        assertTrue(info.get("parse_success").asBoolean());
        assertEquals(0, info.get("errors").size());
        assertEquals("2026-03-01T12:00:00Z", info.get("extracted_at").asText());

        JsonNode summary = json.get("topology_summary");
        assertEquals(2, summary.get("node_count").asInt());
        assertEquals(1, summary.get("link_count").asInt());
        assertEquals(2, summary.get("node_containers").get("nodes").asInt());
        assertEquals(10.0, summary.get("duration").asDouble(), 0);

        JsonNode node = json.get("nodes").get(1);
        assertEquals("nodes", node.get("container").asText());
        assertEquals(1, node.get("index").asInt());
        assertEquals("host", node.get("type").asText());
        assertEquals("wired", node.get("medium").asText());

        JsonNode link = json.get("links").get(0);
        assertEquals(0, link.get("source").get("index").asInt());
        assertEquals(1, link.get("target").get("index").asInt());
        assertEquals("point-to-point", link.get("type").asText());
        assertEquals("5Mbps", link.get("data_rate").asText());
        assertEquals("devices", link.get("device_container").asText());

        JsonNode assignment = json.get("ip_assignments").get(0);
        assertEquals("devices", assignment.get("device_container").asText());
        assertEquals("10.1.1.0", assignment.get("base").asText());
        assertEquals("255.255.255.0", assignment.get("mask").asText());

        JsonNode application = json.get("applications").get(0);
        assertEquals("PacketSink", application.get("type").asText());
        assertEquals(1, application.get("node").get("index").asInt());
        assertEquals("udp", application.get("protocol").asText());
        assertEquals(4000, application.get("port").asInt());
        assertFalse(application.has("remote_address"));
        assertEquals(0.5, application.get("start_time").asDouble(), 0);

        assertEquals("5Mbps", json.get("helper_configs").get("p2p").get("DataRate").asText());
    }

    @Test
    void failedExtraction() throws IOException {
        JsonNode json = write(new ScriptExtractor().extract("x = (\n", "broken"));
        JsonNode info = json.get("extraction_info");
        assertFalse(info.get("parse_success").asBoolean());
        assertEquals(1, info.get("errors").size());
        assertEquals(0, json.get("nodes").size());
        assertEquals(0, json.get("topology_summary").get("node_containers").size());
    }
}
