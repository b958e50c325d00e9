/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.converter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

class ScriptBatchProcessorTest {

    @TempDir
    Path tempDir;

    private Path simulatorRoot;

    private Path workspaceRoot;

    private ScriptBatchProcessor processor;

    private void write(String relativePath, String content) throws IOException {
        Path file = simulatorRoot.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @BeforeEach
    void setUp() throws IOException {
        simulatorRoot = tempDir.resolve("ns-3");
        workspaceRoot = tempDir.resolve("workspace");
        try (InputStream is = Objects.requireNonNull(getClass().getResourceAsStream("/scripts/first.py"))) {
            Path first = simulatorRoot.resolve("src/point-to-point/examples/first.py");
            Files.createDirectories(first.getParent());
            Files.copy(is, first);
        }
        write("src/csma/examples/broken.py", "nodes = ns.NodeContainer()\nif nodes\n    pass\n");
        write("src/csma/examples/test_csma.py", "nodes = ns.NodeContainer()\nnodes.Create(2)\n");
        write("src/wifi/examples/readme.txt", "not a script");
        write("examples/tutorial/hello.py", "print('hello')\n");
        write("examples/tutorial/__init__.py", "");
        write("examples/test/helpers.py", "nodes = ns.NodeContainer()\nnodes.Create(2)\n");
        processor = new ScriptBatchProcessor(simulatorRoot, workspaceRoot);
    }

    @Test
    void discoverSkipsTestsAndPackages() {
        assertEquals(List.of("examples/tutorial/hello.py", "src/csma/examples/broken.py", "src/point-to-point/examples/first.py"),
                processor.discoverScripts());
    }

    @Test
    void processValidScript() throws IOException {
        ProcessingReport report = processor.process("src/point-to-point/examples/first.py");
        assertTrue(report.isSuccess());
        assertTrue(report.getErrors().isEmpty());
        assertEquals(2, report.getNodeCount());
        assertEquals(1, report.getLinkCount());
        assertEquals(1, report.getFlowCount());

        Path extracted = workspaceRoot.resolve("extracted/src/point-to-point/examples/first.extracted.json");
        assertEquals(extracted, report.getExtractedPath().orElseThrow());
        assertTrue(Files.readString(extracted).contains("\"extraction_info\""));

        Path topology = workspaceRoot.resolve("topologies/ns3-examples/point-to-point/first.json");
        assertEquals(topology, report.getTopologyPath().orElseThrow());
        assertTrue(Files.readString(topology).contains("\"trafficFlows\""));
    }

    @Test
    void failedExtractionIsSavedButNotConverted() {
        ProcessingReport report = processor.process("src/csma/examples/broken.py");
        assertFalse(report.isSuccess());
        assertTrue(report.getErrors().get(0).startsWith("Syntax error at line 2"));
        assertTrue(report.getExtractedPath().isPresent());
        assertTrue(Files.exists(report.getExtractedPath().get()));
        assertTrue(report.getTopologyPath().isEmpty());

        ProcessingReport empty = processor.process("examples/tutorial/hello.py");
        assertFalse(empty.isSuccess());
        assertTrue(empty.getErrors().isEmpty());
        assertEquals(List.of("No topology elements found"), empty.getWarnings());
    }

    @Test
    void invalidPaths() {
        ProcessingReport missing = processor.process("src/csma/examples/missing.py");
        assertFalse(missing.isSuccess());
        assertTrue(missing.getErrors().get(0).startsWith("File not found: "));

        ProcessingReport notPython = processor.process("src/wifi/examples/readme.txt");
        assertTrue(notPython.getErrors().get(0).startsWith("Not a Python file: "));
        assertTrue(notPython.getExtractedPath().isEmpty());
    }

    @Test
    void processAllAndSummarize() {
        List<ProcessingReport> reports = processor.processAll();
        assertEquals(3, reports.size());
        BatchSummary summary = BatchSummary.of(reports);
        assertEquals(3, summary.totalFiles());
        assertEquals(1, summary.successful());
        assertEquals(2, summary.failed());
        assertEquals(2, summary.totalNodes());
        assertEquals(1, summary.totalLinks());
        assertEquals(100.0 / 3, summary.successRate(), 1e-9);
        assertEquals(List.of("src/point-to-point/examples/first.py"), summary.successfulFiles());
        assertEquals(List.of("examples/tutorial/hello.py", "src/csma/examples/broken.py"), summary.failedFiles());
        assertEquals(1, summary.errors().size());
        assertTrue(summary.errors().get(0).startsWith("src/csma/examples/broken.py: Syntax error"));
    }

    @Test
    void emptyBatch() {
        BatchSummary summary = BatchSummary.of(List.of());
        assertEquals(0, summary.totalFiles());
        assertEquals(0, summary.successRate(), 0);
    }

    @Test
    void moduleOfScript() {
        assertEquals("wifi", ScriptBatchProcessor.moduleOf(Path.of("src/wifi/examples/wifi-adhoc.py")));
        assertEquals("tutorial", ScriptBatchProcessor.moduleOf(Path.of("tutorial/examples/first.py")));
        assertEquals("misc", ScriptBatchProcessor.moduleOf(Path.of("examples/tutorial/hello.py")));
    }
}
