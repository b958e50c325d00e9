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
import com.powsybl.gridcomm.util.Reports;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A generated script and the report node of its generation. The script is always produced, callers decide from the
 * reported anomalies whether it can be trusted.
 */
public class GenerationResult {

    private final String script;

    private final ReportNode reportNode;

    public GenerationResult(String script, ReportNode reportNode) {
        this.script = Objects.requireNonNull(script);
        this.reportNode = Objects.requireNonNull(reportNode);
    }

    public String getScript() {
        return script;
    }

    public ReportNode getReportNode() {
        return reportNode;
    }

    public List<ReportNode> getDiagnostics() {
        return Reports.getDiagnostics(reportNode);
    }

    public boolean hasWarnings() {
        return !Reports.getDiagnostics(reportNode, TypedValue.WARN_SEVERITY).isEmpty() || hasErrors();
    }

    public boolean hasErrors() {
        return !Reports.getDiagnostics(reportNode, TypedValue.ERROR_SEVERITY).isEmpty();
    }

    public void write(Path file) {
        Objects.requireNonNull(file);
        try {
            Files.writeString(file, script, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
