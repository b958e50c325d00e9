/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.extractor;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridcomm.extractor.ast.PythonParser;
import com.powsybl.gridcomm.extractor.ast.ScriptSyntaxException;
import com.powsybl.gridcomm.extractor.ast.Statement;
import com.powsybl.gridcomm.util.Markers;
import com.powsybl.gridcomm.util.Reports;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Recovers the topology of a simulation script: node containers, the links device helpers install between their
 * nodes, address assignments and applications.
 * <p>
 * Extraction never throws on script content. A file that cannot be read or parsed gives a result with an error and
 * {@code success=false}; ambiguities resolved by a heuristic are reported as warnings.
 */
public class ScriptExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptExtractor.class);

    private static final int DESCRIPTION_SCAN_LINES = 30;

    private static final int DESCRIPTION_MAX_LENGTH = 500;

    public ExtractionResult extract(Path file) {
        return extract(file, Reports.createRootReportNode());
    }

    public ExtractionResult extract(Path file, ReportNode reportNode) {
        Objects.requireNonNull(file);
        Objects.requireNonNull(reportNode);
        ExtractionResult result = new ExtractionResult(file.toString(),
                Reports.createExtractionReportNode(reportNode, file.toString()))
                .setScriptName(StringUtils.removeEnd(file.getFileName().toString(), ".py"))
                .setModuleName(inferModuleName(file));
        String source;
        try {
            source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.warn("Cannot read script {}: {}", file, e.toString());
            Reports.reportReadError(result.getReportNode(), e.toString());
            return result;
        }
        return extract(result, source);
    }

    public ExtractionResult extract(String source, String name) {
        return extract(source, name, Reports.createRootReportNode());
    }

    public ExtractionResult extract(String source, String name, ReportNode reportNode) {
        Objects.requireNonNull(source);
        Objects.requireNonNull(reportNode);
        ExtractionResult result = new ExtractionResult(name, Reports.createExtractionReportNode(reportNode, name));
        return extract(result.setScriptName(name), source);
    }

    private ExtractionResult extract(ExtractionResult result, String source) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        result.setDescription(extractDescription(source));

        List<Statement> module;
        try {
            module = PythonParser.parse(source);
        } catch (ScriptSyntaxException e) {
            LOGGER.warn("Script {} cannot be parsed: {}", result.getSourceFile(), e.getMessage());
            Reports.reportSyntaxError(result.getReportNode(), e.getLine(), e.getReason());
            return result;
        }

        new TopologyVisitor(result).walk(module);
        postProcess(result);

        if (!result.getNodes().isEmpty() || !result.getLinks().isEmpty()) {
            result.setSuccess(true);
        } else {
            Reports.reportNoTopology(result.getReportNode());
        }

        stopwatch.stop();
        LOGGER.info(Markers.PERFORMANCE_MARKER, "Script {} extracted in {} ms: {} nodes, {} links, {} warnings",
                result.getScriptName(), stopwatch.elapsed(TimeUnit.MILLISECONDS), result.getNodes().size(),
                result.getLinks().size(), result.getWarnings().size());
        return result;
    }

    /**
     * Module of a script in a simulator source tree: {@code src/<module>/examples/x.py}, or the directory holding
     * {@code examples}.
     */
    static String inferModuleName(Path file) {
        List<String> parts = new ArrayList<>();
        file.forEach(part -> parts.add(part.toString()));
        int src = parts.indexOf("src");
        if (src >= 0) {
            return src + 1 < parts.size() - 1 ? parts.get(src + 1) : "";
        }
        int examples = parts.indexOf("examples");
        if (examples > 0) {
            return parts.get(examples - 1);
        }
        return "";
    }

    /**
     * Joins the leading docstring, or the leading comment lines when there is none, of the first lines of the
     * script.
     */
    static String extractDescription(String source) {
        List<String> description = new ArrayList<>();
        String[] lines = source.split("\n", -1);
        String docstringQuote = null;
        for (int i = 0; i < Math.min(lines.length, DESCRIPTION_SCAN_LINES); i++) {
            String line = lines[i].strip();
            if (docstringQuote != null) {
                int end = line.indexOf(docstringQuote);
                if (end >= 0) {
                    if (end > 0) {
                        description.add(line.substring(0, end));
                    }
                    break;
                }
                description.add(line);
            } else if (line.startsWith("\"\"\"") || line.startsWith("'''")) {
                String quote = line.substring(0, 3);
                String remainder = line.substring(3);
                int end = remainder.indexOf(quote);
                if (end >= 0) {
                    description.add(remainder.substring(0, end));
                    break;
                }
                docstringQuote = quote;
                if (!remainder.isEmpty()) {
                    description.add(remainder);
                }
            } else if (line.startsWith("#")) {
                String comment = line.substring(1).strip();
                if (!comment.isEmpty() && !comment.startsWith("!")) {
                    description.add(comment);
                }
            } else if (!line.isEmpty() && !line.startsWith("import") && !line.startsWith("from")) {
                break;
            }
        }
        return StringUtils.left(String.join(" ", description).strip(), DESCRIPTION_MAX_LENGTH);
    }

    private static void postProcess(ExtractionResult result) {
        Set<NodeKey> keys = new HashSet<>();
        result.getNodes().removeIf(node -> !keys.add(node.getKey()));

        Iterator<ExtractedLink> it = result.getLinks().iterator();
        while (it.hasNext()) {
            ExtractedLink link = it.next();
            boolean sourceExists = keys.contains(link.source());
            boolean targetExists = keys.contains(link.target());
            if (!sourceExists || !targetExists) {
                if (!sourceExists) {
                    Reports.reportUnknownNodeReference(result.getReportNode(), link.source().toString());
                }
                if (!targetExists) {
                    Reports.reportUnknownNodeReference(result.getReportNode(), link.target().toString());
                }
                it.remove();
            }
        }

        inferNodeRoles(result);
    }

    private static void inferNodeRoles(ExtractionResult result) {
        Map<NodeKey, Integer> degrees = new HashMap<>();
        for (ExtractedLink link : result.getLinks()) {
            degrees.merge(link.source(), 1, Integer::sum);
            degrees.merge(link.target(), 1, Integer::sum);
        }
        for (ExtractedNode node : result.getNodes()) {
            if (node.getRole() == NodeRole.SWITCH) {
                continue;
            }
            int degree = degrees.getOrDefault(node.getKey(), 0);
            if (degree > 2 && node.getRole() == NodeRole.HOST) {
                node.setRole(NodeRole.ROUTER);
            } else if (degree == 0) {
                node.setRole(NodeRole.HOST).setInferredRole("isolated");
            }
        }
    }
}
