/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;
import com.powsybl.gridcomm.util.Reports;

import java.util.*;

/**
 * Everything recovered from one script, possibly incomplete. Errors mean the script could not be read or parsed and
 * nothing else was extracted. Warnings record the ambiguities resolved by a heuristic. Both are reported under the
 * report node of the extraction.
 */
public class ExtractionResult {

    public static final double DURATION_DEFAULT_VALUE = 10.0;

    private final String sourceFile;

    private String scriptName = "";

    private String moduleName = "";

    private String description = "";

    private final List<ExtractedNode> nodes = new ArrayList<>();

    private final List<ExtractedLink> links = new ArrayList<>();

    private final List<ExtractedAddressAssignment> addressAssignments = new ArrayList<>();

    private final List<ExtractedApplication> applications = new ArrayList<>();

    private final Map<String, Integer> nodeContainers = new LinkedHashMap<>();

    private final Map<String, ChannelMedium> deviceContainers = new LinkedHashMap<>();

    private final Map<String, Map<String, String>> helperConfigs = new LinkedHashMap<>();

    private final ReportNode reportNode;

    private boolean success = false;

    private double duration = DURATION_DEFAULT_VALUE;

    public ExtractionResult(String sourceFile) {
        this(sourceFile, Reports.createRootReportNode());
    }

    public ExtractionResult(String sourceFile, ReportNode reportNode) {
        this.sourceFile = Objects.requireNonNull(sourceFile);
        this.reportNode = Objects.requireNonNull(reportNode);
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public String getScriptName() {
        return scriptName;
    }

    public ExtractionResult setScriptName(String scriptName) {
        this.scriptName = Objects.requireNonNull(scriptName);
        return this;
    }

    public String getModuleName() {
        return moduleName;
    }

    public ExtractionResult setModuleName(String moduleName) {
        this.moduleName = Objects.requireNonNull(moduleName);
        return this;
    }

    public String getDescription() {
        return description;
    }

    public ExtractionResult setDescription(String description) {
        this.description = Objects.requireNonNull(description);
        return this;
    }

    public List<ExtractedNode> getNodes() {
        return nodes;
    }

    public Optional<ExtractedNode> getNode(NodeKey key) {
        return nodes.stream().filter(node -> node.getKey().equals(key)).findFirst();
    }

    public List<ExtractedLink> getLinks() {
        return links;
    }

    public List<ExtractedAddressAssignment> getAddressAssignments() {
        return addressAssignments;
    }

    public List<ExtractedApplication> getApplications() {
        return applications;
    }

    public Map<String, Integer> getNodeContainers() {
        return nodeContainers;
    }

    public int getNodeCount(String container) {
        return nodeContainers.getOrDefault(container, 0);
    }

    public Map<String, ChannelMedium> getDeviceContainers() {
        return deviceContainers;
    }

    public Map<String, Map<String, String>> getHelperConfigs() {
        return helperConfigs;
    }

    public Map<String, String> getHelperConfig(String helperName) {
        return helperConfigs.getOrDefault(helperName, Collections.emptyMap());
    }

    public boolean isSuccess() {
        return success;
    }

    ExtractionResult setSuccess(boolean success) {
        this.success = success;
        return this;
    }

    public double getDuration() {
        return duration;
    }

    public ExtractionResult setDuration(double duration) {
        this.duration = duration;
        return this;
    }

    public ReportNode getReportNode() {
        return reportNode;
    }

    public List<ReportNode> getErrors() {
        return Reports.getDiagnostics(reportNode, TypedValue.ERROR_SEVERITY);
    }

    public List<ReportNode> getWarnings() {
        return Reports.getDiagnostics(reportNode, TypedValue.WARN_SEVERITY);
    }
}
