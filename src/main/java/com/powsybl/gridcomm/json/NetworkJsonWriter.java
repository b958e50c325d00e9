/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.powsybl.gridcomm.failure.FailureEvent;
import com.powsybl.gridcomm.failure.FailureScenario;
import com.powsybl.gridcomm.network.*;
import com.powsybl.gridcomm.network.grid.GridLink;
import com.powsybl.gridcomm.network.grid.GridNode;
import com.powsybl.gridcomm.network.grid.GridTrafficFlow;
import com.powsybl.gridcomm.simulation.TrafficFlow;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a network as pretty-printed JSON. Nodes, links and flows are written in insertion order.
 */
public final class NetworkJsonWriter {

    private NetworkJsonWriter() {
    }

    public static void writeJson(Network network, Path file) {
        Objects.requireNonNull(file);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeJson(network, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void writeJson(Network network, Writer writer) {
        Objects.requireNonNull(network);
        Objects.requireNonNull(writer);
        try (JsonGenerator jsonGenerator = new JsonFactory()
                .createGenerator(writer)
                .useDefaultPrettyPrinter()) {
            jsonGenerator.writeStartObject();
            jsonGenerator.writeStringField("id", network.getId());
            jsonGenerator.writeNumberField("simulationDuration", network.getSimulationDuration());

            writeStringMap("metadata", network.getMetadata(), jsonGenerator);

            jsonGenerator.writeFieldName("nodes");
            jsonGenerator.writeStartArray();
            for (Node node : network.getNodes()) {
                jsonGenerator.writeStartObject();
                writeJson(node, jsonGenerator);
                jsonGenerator.writeEndObject();
            }
            jsonGenerator.writeEndArray();

            jsonGenerator.writeFieldName("links");
            jsonGenerator.writeStartArray();
            for (Link link : network.getLinks()) {
                jsonGenerator.writeStartObject();
                writeJson(link, jsonGenerator);
                jsonGenerator.writeEndObject();
            }
            jsonGenerator.writeEndArray();

            jsonGenerator.writeFieldName("trafficFlows");
            jsonGenerator.writeStartArray();
            for (TrafficFlow flow : network.getTrafficFlows()) {
                jsonGenerator.writeStartObject();
                writeJson(flow, jsonGenerator);
                jsonGenerator.writeEndObject();
            }
            jsonGenerator.writeEndArray();

            if (network.getFailureScenario().isPresent()) {
                jsonGenerator.writeFieldName("failureScenario");
                writeJson(network.getFailureScenario().get(), jsonGenerator);
            }

            writeIssues("warnings", network.getWarnings(), jsonGenerator);
            writeIssues("todos", network.getTodos(), jsonGenerator);

            jsonGenerator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeJson(Node node, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeStringField("id", node.getId());
        jsonGenerator.writeStringField("name", node.getName());
        jsonGenerator.writeStringField("kind", node.getKind().name());
        jsonGenerator.writeStringField("medium", node.getMedium().name());
        if (node.getPosition() != null) {
            jsonGenerator.writeNumberField("x", node.getPosition().x());
            jsonGenerator.writeNumberField("y", node.getPosition().y());
        }
        if (node.isServer()) {
            jsonGenerator.writeBooleanField("server", true);
        }
        if (node.getDescription() != null && !node.getDescription().isEmpty()) {
            jsonGenerator.writeStringField("description", node.getDescription());
        }
        if (node instanceof GridNode gridNode) {
            jsonGenerator.writeStringField("gridType", gridNode.getGridType().name());
            jsonGenerator.writeStringField("gridRole", gridNode.getRole().name());
            jsonGenerator.writeStringField("protocol", gridNode.getProtocol().name());
        }
        if (!node.getProperties().isEmpty()) {
            writeStringMap("properties", node.getProperties(), jsonGenerator);
        }
        jsonGenerator.writeFieldName("ports");
        jsonGenerator.writeStartArray();
        for (Port port : node.getPorts()) {
            jsonGenerator.writeStartObject();
            jsonGenerator.writeStringField("id", port.getId());
            jsonGenerator.writeNumberField("number", port.getNumber());
            jsonGenerator.writeStringField("type", port.getType().name());
            if (port.hasIpAddress()) {
                jsonGenerator.writeStringField("ipAddress", port.getIpAddress());
                jsonGenerator.writeStringField("netmask", port.getNetmask());
            }
            if (port.isBound()) {
                jsonGenerator.writeStringField("link", port.getLinkId());
            }
            jsonGenerator.writeEndObject();
        }
        jsonGenerator.writeEndArray();
    }

    private static void writeJson(Link link, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeStringField("id", link.getId());
        writeEndpoint("source", link.getSource(), jsonGenerator);
        writeEndpoint("target", link.getTarget(), jsonGenerator);
        jsonGenerator.writeStringField("channel", link.getChannel().name());
        jsonGenerator.writeStringField("dataRate", link.getDataRate());
        jsonGenerator.writeStringField("delay", link.getDelay());
        if (link instanceof GridLink gridLink) {
            jsonGenerator.writeStringField("gridLinkType", gridLink.getGridLinkType().name());
            jsonGenerator.writeStringField("reliabilityClass", gridLink.getReliabilityClass().name());
            if (gridLink.getBitErrorRate() != 0) {
                jsonGenerator.writeNumberField("bitErrorRate", gridLink.getBitErrorRate());
            }
        }
    }

    private static void writeEndpoint(String fieldName, LinkEndpoint endpoint, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeFieldName(fieldName);
        jsonGenerator.writeStartObject();
        jsonGenerator.writeStringField("node", endpoint.nodeId());
        jsonGenerator.writeStringField("port", endpoint.portId());
        jsonGenerator.writeEndObject();
    }

    private static void writeJson(TrafficFlow flow, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeStringField("id", flow.getId());
        jsonGenerator.writeStringField("name", flow.getName());
        jsonGenerator.writeStringField("source", flow.getSourceNodeId());
        jsonGenerator.writeStringField("target", flow.getTargetNodeId());
        if (flow.getDestinationAddress() != null && !flow.getDestinationAddress().isEmpty()) {
            jsonGenerator.writeStringField("destinationAddress", flow.getDestinationAddress());
        }
        jsonGenerator.writeStringField("protocol", flow.getProtocol().name());
        jsonGenerator.writeStringField("application", flow.getApplication().name());
        jsonGenerator.writeNumberField("port", flow.getPort());
        jsonGenerator.writeNumberField("startTime", flow.getStartTime());
        jsonGenerator.writeNumberField("stopTime", flow.getStopTime());
        jsonGenerator.writeStringField("dataRate", flow.getDataRate());
        jsonGenerator.writeNumberField("packetSize", flow.getPacketSize());
        if (flow instanceof GridTrafficFlow gridFlow) {
            jsonGenerator.writeStringField("trafficClass", gridFlow.getTrafficClass().name());
            jsonGenerator.writeStringField("priority", gridFlow.getPriority().name());
            jsonGenerator.writeNumberField("intervalMs", gridFlow.getEffectiveIntervalMs());
        }
    }

    private static void writeJson(FailureScenario scenario, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeStartObject();
        jsonGenerator.writeStringField("id", scenario.getId());
        jsonGenerator.writeFieldName("events");
        jsonGenerator.writeStartArray();
        for (FailureEvent event : scenario.getEvents()) {
            jsonGenerator.writeStartObject();
            jsonGenerator.writeStringField("id", event.getId());
            jsonGenerator.writeStringField("type", event.getType().name());
            jsonGenerator.writeStringField("targetType", event.getTargetType().name());
            jsonGenerator.writeFieldName("targets");
            jsonGenerator.writeStartArray();
            for (String target : event.getAllTargets()) {
                jsonGenerator.writeString(target);
            }
            jsonGenerator.writeEndArray();
            jsonGenerator.writeNumberField("triggerTime", event.getTriggerTime());
            if (event.getDuration() > 0) {
                jsonGenerator.writeNumberField("duration", event.getDuration());
            }
            jsonGenerator.writeEndObject();
        }
        jsonGenerator.writeEndArray();
        jsonGenerator.writeEndObject();
    }

    private static void writeIssues(String fieldName, List<NetworkIssue> issues, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeFieldName(fieldName);
        jsonGenerator.writeStartArray();
        for (NetworkIssue issue : issues) {
            jsonGenerator.writeStartObject();
            jsonGenerator.writeStringField("type", issue.type());
            jsonGenerator.writeStringField("source", issue.source());
            jsonGenerator.writeStringField("message", issue.message());
            jsonGenerator.writeEndObject();
        }
        jsonGenerator.writeEndArray();
    }

    static void writeStringMap(String fieldName, Map<String, String> map, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeFieldName(fieldName);
        jsonGenerator.writeStartObject();
        for (Map.Entry<String, String> e : map.entrySet()) {
            jsonGenerator.writeStringField(e.getKey(), e.getValue());
        }
        jsonGenerator.writeEndObject();
    }
}
