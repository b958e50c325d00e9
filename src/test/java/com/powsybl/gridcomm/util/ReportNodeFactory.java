/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.util;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.test.PowsyblTestReportResourceBundle;
import com.powsybl.gridcomm.util.report.PowsyblGridCommReportResourceBundle;

import java.util.List;

public final class ReportNodeFactory {

    private ReportNodeFactory() {
    }

    public static ReportNode create() {
        return ReportNode.newRootReportNode()
                .withResourceBundles(PowsyblGridCommReportResourceBundle.BASE_NAME, PowsyblTestReportResourceBundle.TEST_BASE_NAME)
                .withMessageTemplate("testReport")
                .build();
    }

    public static List<String> messageKeys(List<ReportNode> reportNodes) {
        return reportNodes.stream().map(ReportNode::getMessageKey).toList();
    }
}
