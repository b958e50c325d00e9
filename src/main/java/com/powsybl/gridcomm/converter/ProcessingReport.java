/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.converter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of the processing of one script by {@link ScriptBatchProcessor}.
 */
public class ProcessingReport {

    private final String relativePath;

    private boolean success = false;

    private Path extractedPath;

    private Path topologyPath;

    private final List<String> errors = new ArrayList<>();

    private final List<String> warnings = new ArrayList<>();

    private int nodeCount = 0;

    private int linkCount = 0;

    private int flowCount = 0;

    ProcessingReport(String relativePath) {
        this.relativePath = Objects.requireNonNull(relativePath);
    }

    public String getRelativePath() {
        return relativePath;
    }

    public boolean isSuccess() {
        return success;
    }

    void setSuccess(boolean success) {
        this.success = success;
    }

    public Optional<Path> getExtractedPath() {
        return Optional.ofNullable(extractedPath);
    }

    void setExtractedPath(Path extractedPath) {
        this.extractedPath = extractedPath;
    }

    public Optional<Path> getTopologyPath() {
        return Optional.ofNullable(topologyPath);
    }

    void setTopologyPath(Path topologyPath) {
        this.topologyPath = topologyPath;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    void addError(String error) {
        errors.add(Objects.requireNonNull(error));
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    void addWarning(String warning) {
        warnings.add(Objects.requireNonNull(warning));
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public int getLinkCount() {
        return linkCount;
    }

    public int getFlowCount() {
        return flowCount;
    }

    void setCounts(int nodeCount, int linkCount, int flowCount) {
        this.nodeCount = nodeCount;
        this.linkCount = linkCount;
        this.flowCount = flowCount;
    }

    @Override
    public String toString() {
        return "ProcessingReport(relativePath=" + relativePath
                + ", success=" + success
                + ", nodeCount=" + nodeCount
                + ", linkCount=" + linkCount
                + ", errors=" + errors.size()
                + ")";
    }
}
