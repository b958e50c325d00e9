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
import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridcomm.extractor.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Writes an extraction result as pretty-printed JSON, in sections: extraction info, topology summary, nodes, links,
 * address assignments, applications and helper configurations.
 */
public final class ExtractionJsonWriter {

    private ExtractionJsonWriter() {
    }

    public static void writeJson(ExtractionResult extraction, Path file) {
        Objects.requireNonNull(file);
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeJson(extraction, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void writeJson(ExtractionResult extraction, Writer writer) {
        writeJson(extraction, writer, Clock.systemUTC());
    }

    static void writeJson(ExtractionResult extraction, Writer writer, Clock clock) {
        Objects.requireNonNull(extraction);
        Objects.requireNonNull(writer);
        Objects.requireNonNull(clock);
        try (JsonGenerator jsonGenerator = new JsonFactory()
                .createGenerator(writer)
                .useDefaultPrettyPrinter()) {
            jsonGenerator.writeStartObject();

            jsonGenerator.writeFieldName("extraction_info");
            jsonGenerator.writeStartObject();
            jsonGenerator.writeStringField("source_file", extraction.getSourceFile());
            jsonGenerator.writeStringField("script_name", extraction.getScriptName());
            jsonGenerator.writeStringField("module_name", extraction.getModuleName());
            jsonGenerator.writeStringField("description", extraction.getDescription());
            jsonGenerator.writeBooleanField("parse_success", extraction.isSuccess());
            writeMessages("errors", extraction.getErrors(), jsonGenerator);
            writeMessages("warnings", extraction.getWarnings(), jsonGenerator);
            jsonGenerator.writeStringField("extracted_at", Instant.now(clock).toString());
            jsonGenerator.writeEndObject();

            jsonGenerator.writeFieldName("topology_summary");
            jsonGenerator.writeStartObject();
            jsonGenerator.writeNumberField("node_count", extraction.getNodes().size());
            jsonGenerator.writeNumberField("link_count", extraction.getLinks().size());
            jsonGenerator.writeFieldName("node_containers");
            jsonGenerator.writeStartObject();
            for (Map.Entry<String, Integer> e : extraction.getNodeContainers().entrySet()) {
                jsonGenerator.writeNumberField(e.getKey(), e.getValue());
            }
            jsonGenerator.writeEndObject();
            jsonGenerator.writeNumberField("duration", extraction.getDuration());
            jsonGenerator.writeEndObject();

            jsonGenerator.writeFieldName("nodes");
            jsonGenerator.writeStartArray();
            for (ExtractedNode node : extraction.getNodes()) {
                jsonGenerator.writeStartObject();
                jsonGenerator.writeStringField("container", node.getContainer());
                jsonGenerator.writeNumberField("index", node.getIndex());
                jsonGenerator.writeStringField("type", node.getRole().getLabel());
                jsonGenerator.writeStringField("medium", node.getMediumHint().getLabel());
                jsonGenerator.writeStringField("role", node.getInferredRole());
                jsonGenerator.writeEndObject();
            }
            jsonGenerator.writeEndArray();

            jsonGenerator.writeFieldName("links");
            jsonGenerator.writeStartArray();
            for (ExtractedLink link : extraction.getLinks()) {
                jsonGenerator.writeStartObject();
                writeNodeKey("source", link.source(), jsonGenerator);
                writeNodeKey("target", link.target(), jsonGenerator);
                jsonGenerator.writeStringField("type", link.medium().getLabel());
                jsonGenerator.writeStringField("data_rate", link.dataRate());
                jsonGenerator.writeStringField("delay", link.delay());
                if (!link.deviceContainer().isEmpty()) {
                    jsonGenerator.writeStringField("device_container", link.deviceContainer());
                }
                jsonGenerator.writeEndObject();
            }
            jsonGenerator.writeEndArray();

            jsonGenerator.writeFieldName("ip_assignments");
            jsonGenerator.writeStartArray();
            for (ExtractedAddressAssignment assignment : extraction.getAddressAssignments()) {
                jsonGenerator.writeStartObject();
                jsonGenerator.writeStringField("device_container", assignment.deviceContainer());
                jsonGenerator.writeStringField("base", assignment.base());
                jsonGenerator.writeStringField("mask", assignment.netmask());
                jsonGenerator.writeEndObject();
            }
            jsonGenerator.writeEndArray();

            jsonGenerator.writeFieldName("applications");
            jsonGenerator.writeStartArray();
            for (ExtractedApplication application : extraction.getApplications()) {
                writeJson(application, jsonGenerator);
            }
            jsonGenerator.writeEndArray();

            jsonGenerator.writeFieldName("helper_configs");
            jsonGenerator.writeStartObject();
            for (Map.Entry<String, Map<String, String>> e : extraction.getHelperConfigs().entrySet()) {
                NetworkJsonWriter.writeStringMap(e.getKey(), e.getValue(), jsonGenerator);
            }
            jsonGenerator.writeEndObject();

            jsonGenerator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeJson(ExtractedApplication application, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeStartObject();
        jsonGenerator.writeStringField("type", application.getKind().getLabel());
        writeNodeKey("node", application.getNode(), jsonGenerator);
        jsonGenerator.writeStringField("protocol", application.getProtocol().name().toLowerCase(Locale.ROOT));
        jsonGenerator.writeNumberField("port", application.getPort());
        if (!application.getRemoteAddress().isEmpty()) {
            jsonGenerator.writeStringField("remote_address", application.getRemoteAddress());
        }
        if (!application.getDataRate().isEmpty()) {
            jsonGenerator.writeStringField("data_rate", application.getDataRate());
        }
        if (application.getPacketSize() > 0) {
            jsonGenerator.writeNumberField("packet_size", application.getPacketSize());
        }
        jsonGenerator.writeNumberField("start_time", application.getStartTime());
        jsonGenerator.writeNumberField("stop_time", application.getStopTime());
        jsonGenerator.writeEndObject();
    }

    private static void writeNodeKey(String fieldName, NodeKey key, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeFieldName(fieldName);
        jsonGenerator.writeStartObject();
        jsonGenerator.writeStringField("container", key.container());
        jsonGenerator.writeNumberField("index", key.index());
        jsonGenerator.writeEndObject();
    }

    private static void writeMessages(String fieldName, List<ReportNode> diagnostics, JsonGenerator jsonGenerator) throws IOException {
        jsonGenerator.writeFieldName(fieldName);
        jsonGenerator.writeStartArray();
        for (ReportNode diagnostic : diagnostics) {
            jsonGenerator.writeString(diagnostic.getMessage());
        }
        jsonGenerator.writeEndArray();
    }
}
