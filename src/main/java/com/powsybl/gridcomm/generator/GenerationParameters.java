/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.generator;

import com.powsybl.gridcomm.address.AddressingParameters;

import java.util.Objects;

/**
 * @see ScriptGenerator
 */
public class GenerationParameters {

    public static final String OUTPUT_DIRECTORY_DEFAULT_VALUE = ".";

    public static final String WIFI_STANDARD_DEFAULT_VALUE = "WIFI_STANDARD_80211g";

    public static final boolean DIAGNOSTIC_COMMENTS_DEFAULT_VALUE = true;

    private String outputDirectory = OUTPUT_DIRECTORY_DEFAULT_VALUE;

    private String wifiStandard = WIFI_STANDARD_DEFAULT_VALUE;

    private boolean diagnosticComments = DIAGNOSTIC_COMMENTS_DEFAULT_VALUE;

    private AddressingParameters addressingParameters = new AddressingParameters();

    public String getOutputDirectory() {
        return outputDirectory;
    }

    /**
     * Directory the script writes its traces and statistics into. Backslashes are turned into slashes.
     */
    public GenerationParameters setOutputDirectory(String outputDirectory) {
        this.outputDirectory = Objects.requireNonNull(outputDirectory).replace('\\', '/');
        return this;
    }

    public String getWifiStandard() {
        return wifiStandard;
    }

    public GenerationParameters setWifiStandard(String wifiStandard) {
        this.wifiStandard = Objects.requireNonNull(wifiStandard);
        return this;
    }

    public boolean isDiagnosticComments() {
        return diagnosticComments;
    }

    /**
     * Whether diagnostics are also written as comments at the end of the script.
     */
    public GenerationParameters setDiagnosticComments(boolean diagnosticComments) {
        this.diagnosticComments = diagnosticComments;
        return this;
    }

    public AddressingParameters getAddressingParameters() {
        return addressingParameters;
    }

    public GenerationParameters setAddressingParameters(AddressingParameters addressingParameters) {
        this.addressingParameters = Objects.requireNonNull(addressingParameters);
        return this;
    }

    @Override
    public String toString() {
        return "GenerationParameters(" +
                "outputDirectory=" + outputDirectory +
                ", wifiStandard=" + wifiStandard +
                ", diagnosticComments=" + diagnosticComments +
                ", addressingParameters=" + addressingParameters +
                ')';
    }
}
