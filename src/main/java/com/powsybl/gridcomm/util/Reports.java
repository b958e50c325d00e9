/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.util;

import com.powsybl.commons.report.ReportConstants;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;
import com.powsybl.gridcomm.util.report.PowsyblGridCommReportResourceBundle;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Report nodes of the resolver, the generator, the extractor and the converter.
 * <p>
 * Every entry point opens a section node under the report node of its caller. Anomalies are added to that section as
 * leaves carrying a severity and are never thrown.
 */
public final class Reports {

    public static final String ROOT_KEY = "gridcomm.root";
    public static final String ADDRESS_RESOLUTION_KEY = "gridcomm.addressResolution";
    public static final String SCRIPT_GENERATION_KEY = "gridcomm.scriptGeneration";
    public static final String EXTRACTION_KEY = "gridcomm.extraction";
    public static final String CONVERSION_KEY = "gridcomm.conversion";

    private static final Set<String> SECTION_KEYS = Set.of(ROOT_KEY, ADDRESS_RESOLUTION_KEY, SCRIPT_GENERATION_KEY,
            EXTRACTION_KEY, CONVERSION_KEY);

    private static final String NETWORK_ID = "networkId";
    private static final String LINK_ID = "linkId";
    private static final String ADDRESS = "address";
    private static final String HELPER = "helper";
    private static final String CONTAINER = "container";
    private static final String COUNT = "count";
    private static final String FLOW_ID = "flowId";
    private static final String REASON = "reason";

    private Reports() {
    }

    public static ReportNode createRootReportNode() {
        return ReportNode.newRootReportNode()
                .withResourceBundles(PowsyblGridCommReportResourceBundle.BASE_NAME)
                .withMessageTemplate(ROOT_KEY)
                .build();
    }

    public static ReportNode createAddressResolutionReportNode(ReportNode reportNode, String networkId) {
        return reportNode.newReportNode()
                .withMessageTemplate(ADDRESS_RESOLUTION_KEY)
                .withUntypedValue(NETWORK_ID, networkId)
                .add();
    }

    public static ReportNode createScriptGenerationReportNode(ReportNode reportNode, String networkId) {
        return reportNode.newReportNode()
                .withMessageTemplate(SCRIPT_GENERATION_KEY)
                .withUntypedValue(NETWORK_ID, networkId)
                .add();
    }

    public static ReportNode createExtractionReportNode(ReportNode reportNode, String sourceFile) {
        return reportNode.newReportNode()
                .withMessageTemplate(EXTRACTION_KEY)
                .withUntypedValue("sourceFile", sourceFile)
                .add();
    }

    public static ReportNode createConversionReportNode(ReportNode reportNode, String scriptName) {
        return reportNode.newReportNode()
                .withMessageTemplate(CONVERSION_KEY)
                .withUntypedValue("scriptName", scriptName)
                .add();
    }

    // address resolution

    public static void reportDanglingLink(ReportNode reportNode, String linkId) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.danglingLink")
                .withUntypedValue(LINK_ID, linkId)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportSwitchPortAddress(ReportNode reportNode, String address, String portId) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.switchPortAddress")
                .withUntypedValue(ADDRESS, address)
                .withUntypedValue("portId", portId)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportDuplicateAddress(ReportNode reportNode, String address, List<String> portIds) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.duplicateAddress")
                .withUntypedValue(ADDRESS, address)
                .withUntypedValue("portIds", String.join(", ", portIds))
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportSubnetCollision(ReportNode reportNode, String subnet, String switchId) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.subnetCollision")
                .withUntypedValue("subnet", subnet)
                .withUntypedValue("switchId", switchId)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    // script generation

    public static void reportUnsupportedLinkKind(ReportNode reportNode, String linkId, String linkKind) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.unsupportedLinkKind")
                .withUntypedValue(LINK_ID, linkId)
                .withUntypedValue("linkKind", linkKind)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportMultipleRoutersOnSegment(ReportNode reportNode, String segmentId, int routerCount) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.multipleRoutersOnSegment")
                .withUntypedValue("segmentId", segmentId)
                .withUntypedValue("routerCount", routerCount)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportUnsupportedRoutingProtocol(ReportNode reportNode, String protocol, String nodeId) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.unsupportedRoutingProtocol")
                .withUntypedValue("protocol", protocol)
                .withUntypedValue("nodeId", nodeId)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    private static void reportFlowSkipped(ReportNode reportNode, String key, String flowId, String reason) {
        reportNode.newReportNode()
                .withMessageTemplate(key)
                .withUntypedValue(FLOW_ID, flowId)
                .withUntypedValue(REASON, reason)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportFlowEndpointMissing(ReportNode reportNode, String flowId, String reason) {
        reportFlowSkipped(reportNode, "gridcomm.flowEndpointMissing", flowId, reason);
    }

    public static void reportFlowEndpointIsSwitch(ReportNode reportNode, String flowId, String reason) {
        reportFlowSkipped(reportNode, "gridcomm.flowEndpointIsSwitch", flowId, reason);
    }

    public static void reportUnresolvedFlowTarget(ReportNode reportNode, String flowId, String reason) {
        reportFlowSkipped(reportNode, "gridcomm.unresolvedFlowTarget", flowId, reason);
    }

    public static void reportUnsupportedApplication(ReportNode reportNode, String application, String flowId) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.unsupportedApplication")
                .withUntypedValue("application", application)
                .withUntypedValue(FLOW_ID, flowId)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    // extraction

    public static void reportReadError(ReportNode reportNode, String error) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.readError")
                .withUntypedValue("error", error)
                .withSeverity(TypedValue.ERROR_SEVERITY)
                .add();
    }

    public static void reportSyntaxError(ReportNode reportNode, int line, String reason) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.syntaxError")
                .withUntypedValue("line", line)
                .withUntypedValue(REASON, reason)
                .withSeverity(TypedValue.ERROR_SEVERITY)
                .add();
    }

    public static void reportNoTopology(ReportNode reportNode) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.noTopology")
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportUnknownNodeReference(ReportNode reportNode, String node) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.unknownNodeReference")
                .withUntypedValue("node", node)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportUnknownNodeCount(ReportNode reportNode, String container, int count) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.unknownNodeCount")
                .withUntypedValue(CONTAINER, container)
                .withUntypedValue(COUNT, count)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportUnknownHelperInstall(ReportNode reportNode, String helper, String container) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.unknownHelperInstall")
                .withUntypedValue(HELPER, helper)
                .withUntypedValue(CONTAINER, container)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportAmbiguousPointToPointInstall(ReportNode reportNode, String helper, int count, String container) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.ambiguousPointToPointInstall")
                .withUntypedValue(HELPER, helper)
                .withUntypedValue(COUNT, count)
                .withUntypedValue(CONTAINER, container)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportEmptyInstall(ReportNode reportNode, String helper, String container) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.emptyInstall")
                .withUntypedValue(HELPER, helper)
                .withUntypedValue(CONTAINER, container)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    // conversion

    public static void reportSwitchTrunkLink(ReportNode reportNode, String sourceName, String targetName) {
        reportNode.newReportNode()
                .withMessageTemplate("gridcomm.switchTrunkLink")
                .withUntypedValue("sourceName", sourceName)
                .withUntypedValue("targetName", targetName)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    // reading back

    public static Optional<String> getSeverity(ReportNode reportNode) {
        return Optional.ofNullable(reportNode.getValues().get(ReportConstants.SEVERITY_KEY))
                .map(value -> value.getValue().toString());
    }

    /**
     * Anomalies reported under a node and its sections, in report order.
     */
    public static List<ReportNode> getDiagnostics(ReportNode reportNode) {
        List<ReportNode> diagnostics = new ArrayList<>();
        collectDiagnostics(reportNode, diagnostics);
        return diagnostics;
    }

    public static List<ReportNode> getDiagnostics(ReportNode reportNode, TypedValue severity) {
        String expected = severity.getValue().toString();
        return getDiagnostics(reportNode).stream()
                .filter(node -> getSeverity(node).filter(expected::equals).isPresent())
                .toList();
    }

    private static void collectDiagnostics(ReportNode reportNode, List<ReportNode> diagnostics) {
        for (ReportNode child : reportNode.getChildren()) {
            if (SECTION_KEYS.contains(child.getMessageKey())) {
                collectDiagnostics(child, diagnostics);
            } else if (getSeverity(child).isPresent()) {
                diagnostics.add(child);
            }
        }
    }
}
