/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.converter;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.gridcomm.extractor.ExtractionResult;
import com.powsybl.gridcomm.extractor.ScriptExtractor;
import com.powsybl.gridcomm.json.ExtractionJsonWriter;
import com.powsybl.gridcomm.json.NetworkJsonWriter;
import com.powsybl.gridcomm.network.Network;
import com.powsybl.gridcomm.util.Markers;
import com.powsybl.gridcomm.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Extracts and converts the example scripts of a simulator source tree.
 * <p>
 * Outputs are written under a workspace that mirrors the simulator layout:
 * <pre>
 * workspace/
 *   extracted/src/csma/examples/csma-ping.extracted.json
 *   topologies/ns3-examples/csma/csma-ping.json
 * </pre>
 * Every script is processed independently: a failure is recorded in its report and the batch goes on.
 */
public class ScriptBatchProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScriptBatchProcessor.class);

    public static final String EXTRACTED_SUFFIX = ".extracted.json";

    private static final String SCRIPT_EXTENSION = ".py";

    private final Path simulatorRoot;

    private final Path extractedDir;

    private final Path topologiesDir;

    private final ScriptExtractor extractor;

    private final TopologyConverter converter;

    public ScriptBatchProcessor(Path simulatorRoot, Path workspaceRoot) {
        this(simulatorRoot, workspaceRoot, new ScriptExtractor(), new TopologyConverter());
    }

    public ScriptBatchProcessor(Path simulatorRoot, Path workspaceRoot, ScriptExtractor extractor,
                                TopologyConverter converter) {
        this.simulatorRoot = Objects.requireNonNull(simulatorRoot);
        Objects.requireNonNull(workspaceRoot);
        this.extractedDir = workspaceRoot.resolve("extracted");
        this.topologiesDir = workspaceRoot.resolve("topologies").resolve("ns3-examples");
        this.extractor = Objects.requireNonNull(extractor);
        this.converter = Objects.requireNonNull(converter);
    }

    /**
     * Lists the example scripts of the simulator tree, relative to its root and sorted: {@code src/*}{@code /examples/*.py}
     * and {@code examples/**}{@code /*.py}, test scripts and package markers excluded.
     */
    public List<String> discoverScripts() {
        List<Path> scripts = new ArrayList<>();
        Path srcDir = simulatorRoot.resolve("src");
        if (Files.isDirectory(srcDir)) {
            try (DirectoryStream<Path> modules = Files.newDirectoryStream(srcDir, Files::isDirectory)) {
                for (Path module : modules) {
                    Path examplesDir = module.resolve("examples");
                    if (Files.isDirectory(examplesDir)) {
                        try (DirectoryStream<Path> files = Files.newDirectoryStream(examplesDir, "*" + SCRIPT_EXTENSION)) {
                            files.forEach(scripts::add);
                        }
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        Path examplesDir = simulatorRoot.resolve("examples");
        if (Files.isDirectory(examplesDir)) {
            try (Stream<Path> files = Files.walk(examplesDir)) {
                files.filter(Files::isRegularFile)
                        .filter(file -> file.getFileName().toString().endsWith(SCRIPT_EXTENSION))
                        .forEach(scripts::add);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return scripts.stream()
                .map(simulatorRoot::relativize)
                .filter(ScriptBatchProcessor::isExample)
                .map(ScriptBatchProcessor::toRelativeString)
                .sorted()
                .toList();
    }

    private static boolean isExample(Path relativePath) {
        String fileName = relativePath.getFileName().toString();
        if (fileName.startsWith("test_") || fileName.equals("__init__.py")) {
            return false;
        }
        for (Path part : relativePath) {
            if (part.toString().equals("test")) {
                return false;
            }
        }
        return true;
    }

    private static String toRelativeString(Path relativePath) {
        List<String> parts = new ArrayList<>();
        relativePath.forEach(part -> parts.add(part.toString()));
        return String.join("/", parts);
    }

    /**
     * Extracts one script, relative to the simulator root, and converts it when the extraction succeeded.
     */
    public ProcessingReport process(String relativePath) {
        Objects.requireNonNull(relativePath);
        ProcessingReport report = new ProcessingReport(relativePath);
        Path rel = Path.of(relativePath);
        Path file = simulatorRoot.resolve(rel);

        if (!Files.isRegularFile(file)) {
            report.addError("File not found: " + file);
            return report;
        }
        if (!file.getFileName().toString().endsWith(SCRIPT_EXTENSION)) {
            report.addError("Not a Python file: " + file);
            return report;
        }

        ReportNode reportNode = Reports.createRootReportNode();
        ExtractionResult extraction = extractor.extract(file, reportNode);
        extraction.getErrors().stream().map(ReportNode::getMessage).forEach(report::addError);
        extraction.getWarnings().stream().map(ReportNode::getMessage).forEach(report::addWarning);

        try {
            Path extractedPath = getExtractedPath(rel);
            Files.createDirectories(extractedPath.getParent());
            ExtractionJsonWriter.writeJson(extraction, extractedPath);
            report.setExtractedPath(extractedPath);
        } catch (IOException | UncheckedIOException e) {
            LOGGER.error("Extraction of {} could not be saved", relativePath, e);
            report.addError("Failed to save extracted data: " + e.getMessage());
        }

        if (!extraction.isSuccess()) {
            return report;
        }

        try {
            Network network = converter.convert(extraction, reportNode);
            report.setCounts(network.getNodeCount(), network.getLinkCount(), network.getTrafficFlows().size());
            Path topologyPath = getTopologyPath(rel);
            Files.createDirectories(topologyPath.getParent());
            NetworkJsonWriter.writeJson(network, topologyPath);
            report.setTopologyPath(topologyPath);
            report.setSuccess(true);
        } catch (IOException | UncheckedIOException | PowsyblException e) {
            LOGGER.error("Conversion of {} failed", relativePath, e);
            report.addError("Failed to convert topology: " + e.getMessage());
        }
        return report;
    }

    public List<ProcessingReport> processAll() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<String> scripts = discoverScripts();
        List<ProcessingReport> reports = new ArrayList<>(scripts.size());
        for (int i = 0; i < scripts.size(); i++) {
            LOGGER.debug("Processing script {}/{}: {}", i + 1, scripts.size(), scripts.get(i));
            reports.add(process(scripts.get(i)));
        }
        stopwatch.stop();
        LOGGER.info(Markers.PERFORMANCE_MARKER, "{} scripts processed in {} ms", scripts.size(),
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return reports;
    }

    Path getExtractedPath(Path relativePath) {
        String stem = stem(relativePath);
        Path parent = relativePath.getParent();
        Path dir = parent != null ? extractedDir.resolve(parent) : extractedDir;
        return dir.resolve(stem + EXTRACTED_SUFFIX);
    }

    Path getTopologyPath(Path relativePath) {
        return topologiesDir.resolve(moduleOf(relativePath)).resolve(stem(relativePath) + ".json");
    }

    /**
     * The directory after {@code src}, otherwise the one before {@code examples}, otherwise {@code misc}.
     */
    static String moduleOf(Path relativePath) {
        List<String> parts = new ArrayList<>();
        relativePath.forEach(part -> parts.add(part.toString()));
        int src = parts.indexOf("src");
        if (src >= 0) {
            return src + 1 < parts.size() ? parts.get(src + 1) : "misc";
        }
        int examples = parts.indexOf("examples");
        if (examples > 0) {
            return parts.get(examples - 1);
        }
        return "misc";
    }

    private static String stem(Path relativePath) {
        String fileName = relativePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
