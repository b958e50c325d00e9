/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.util;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportsTest {

    @Test
    void rootReportNodeUsesGridCommBundle() {
        ReportNode reportNode = Reports.createRootReportNode();
        assertEquals(Reports.ROOT_KEY, reportNode.getMessageKey());
        assertEquals("Grid communication topology", reportNode.getMessage());
    }

    @Test
    void diagnosticsAreCollectedThroughSections() {
        ReportNode reportNode = ReportNodeFactory.create();
        ReportNode extraction = Reports.createExtractionReportNode(reportNode, "lan.py");
        Reports.reportSyntaxError(extraction, 2, "unexpected indent");
        Reports.reportNoTopology(extraction);
        ReportNode conversion = Reports.createConversionReportNode(reportNode, "lan");
        Reports.reportSwitchTrunkLink(conversion, "switches_0", "switches_1");

        assertEquals("Extraction of lan.py", extraction.getMessage());
        assertEquals(List.of("gridcomm.syntaxError", "gridcomm.noTopology", "gridcomm.switchTrunkLink"),
                ReportNodeFactory.messageKeys(Reports.getDiagnostics(reportNode)));

        List<ReportNode> errors = Reports.getDiagnostics(reportNode, TypedValue.ERROR_SEVERITY);
        assertEquals(1, errors.size());
        assertEquals("Syntax error at line 2: unexpected indent", errors.get(0).getMessage());
        assertEquals(TypedValue.ERROR_SEVERITY.getValue().toString(), Reports.getSeverity(errors.get(0)).orElseThrow());

        assertEquals(List.of("No topology elements found"),
                Reports.getDiagnostics(reportNode, TypedValue.WARN_SEVERITY).stream().map(ReportNode::getMessage).toList());
        assertEquals("Shared medium link between switches 'switches_0' and 'switches_1' kept as a bridged trunk",
                Reports.getDiagnostics(reportNode, TypedValue.INFO_SEVERITY).get(0).getMessage());
    }

    @Test
    void noOpReportNodeHasNoDiagnostics() {
        Reports.reportDanglingLink(ReportNode.NO_OP, "l1");
        assertTrue(Reports.getDiagnostics(ReportNode.NO_OP).isEmpty());
    }
}
