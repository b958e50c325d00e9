/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.converter;

import java.util.List;
import java.util.Objects;

/**
 * Totals over the reports of a batch run.
 *
 * @param totalFiles      number of processed scripts
 * @param successful      number of scripts converted into a network
 * @param failed          number of other scripts
 * @param totalNodes      nodes of the successful conversions
 * @param totalLinks      links of the successful conversions
 * @param successRate     percentage of successful scripts, 0 for an empty batch
 * @param errors          first errors of the batch, prefixed with the script path
 * @param successfulFiles paths of the successful scripts
 * @param failedFiles     paths of the failed scripts
 */
public record BatchSummary(int totalFiles, int successful, int failed, int totalNodes, int totalLinks,
                           double successRate, List<String> errors, List<String> successfulFiles,
                           List<String> failedFiles) {

    public static final int MAX_ERRORS = 20;

    public BatchSummary {
        errors = List.copyOf(Objects.requireNonNull(errors));
        successfulFiles = List.copyOf(Objects.requireNonNull(successfulFiles));
        failedFiles = List.copyOf(Objects.requireNonNull(failedFiles));
    }

    public static BatchSummary of(List<ProcessingReport> reports) {
        Objects.requireNonNull(reports);
        List<ProcessingReport> successfulReports = reports.stream().filter(ProcessingReport::isSuccess).toList();
        List<String> failedFiles = reports.stream()
                .filter(report -> !report.isSuccess())
                .map(ProcessingReport::getRelativePath)
                .toList();
        List<String> errors = reports.stream()
                .flatMap(report -> report.getErrors().stream().map(error -> report.getRelativePath() + ": " + error))
                .limit(MAX_ERRORS)
                .toList();
        int totalNodes = successfulReports.stream().mapToInt(ProcessingReport::getNodeCount).sum();
        int totalLinks = successfulReports.stream().mapToInt(ProcessingReport::getLinkCount).sum();
        double successRate = reports.isEmpty() ? 0 : 100.0 * successfulReports.size() / reports.size();
        return new BatchSummary(reports.size(), successfulReports.size(), failedFiles.size(), totalNodes, totalLinks,
                successRate, errors,
                successfulReports.stream().map(ProcessingReport::getRelativePath).toList(),
                failedFiles);
    }
}
