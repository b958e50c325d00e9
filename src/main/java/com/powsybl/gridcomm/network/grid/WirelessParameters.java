/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import java.util.Objects;

public class WirelessParameters implements PhysicalParameters {

    public static final double FREQUENCY_MHZ_DEFAULT_VALUE = 900;
    public static final double BANDWIDTH_MHZ_DEFAULT_VALUE = 20;
    public static final double TX_POWER_DBM_DEFAULT_VALUE = 20;
    public static final double RX_SENSITIVITY_DBM_DEFAULT_VALUE = -90;
    public static final String PROPAGATION_MODEL_DEFAULT_VALUE = "FriisPropagationLossModel";
    public static final String FADING_MODEL_DEFAULT_VALUE = "NakagamiFading";

    private double frequencyMhz = FREQUENCY_MHZ_DEFAULT_VALUE;
    private double bandwidthMhz = BANDWIDTH_MHZ_DEFAULT_VALUE;
    private double txPowerDbm = TX_POWER_DBM_DEFAULT_VALUE;
    private double rxSensitivityDbm = RX_SENSITIVITY_DBM_DEFAULT_VALUE;
    private double antennaGainDbi = 0;
    private String propagationModel = PROPAGATION_MODEL_DEFAULT_VALUE;
    private double pathLossExponent = 2;
    private boolean fadingEnabled = false;
    private String fadingModel = FADING_MODEL_DEFAULT_VALUE;

    public double getFrequencyMhz() {
        return frequencyMhz;
    }

    public WirelessParameters setFrequencyMhz(double frequencyMhz) {
        this.frequencyMhz = frequencyMhz;
        return this;
    }

    public double getBandwidthMhz() {
        return bandwidthMhz;
    }

    public WirelessParameters setBandwidthMhz(double bandwidthMhz) {
        this.bandwidthMhz = bandwidthMhz;
        return this;
    }

    public double getTxPowerDbm() {
        return txPowerDbm;
    }

    public WirelessParameters setTxPowerDbm(double txPowerDbm) {
        this.txPowerDbm = txPowerDbm;
        return this;
    }

    public double getRxSensitivityDbm() {
        return rxSensitivityDbm;
    }

    public WirelessParameters setRxSensitivityDbm(double rxSensitivityDbm) {
        this.rxSensitivityDbm = rxSensitivityDbm;
        return this;
    }

    public double getAntennaGainDbi() {
        return antennaGainDbi;
    }

    public WirelessParameters setAntennaGainDbi(double antennaGainDbi) {
        this.antennaGainDbi = antennaGainDbi;
        return this;
    }

    public String getPropagationModel() {
        return propagationModel;
    }

    public WirelessParameters setPropagationModel(String propagationModel) {
        this.propagationModel = Objects.requireNonNull(propagationModel);
        return this;
    }

    public double getPathLossExponent() {
        return pathLossExponent;
    }

    public WirelessParameters setPathLossExponent(double pathLossExponent) {
        this.pathLossExponent = pathLossExponent;
        return this;
    }

    public boolean isFadingEnabled() {
        return fadingEnabled;
    }

    public WirelessParameters setFadingEnabled(boolean fadingEnabled) {
        this.fadingEnabled = fadingEnabled;
        return this;
    }

    public String getFadingModel() {
        return fadingModel;
    }

    public WirelessParameters setFadingModel(String fadingModel) {
        this.fadingModel = Objects.requireNonNull(fadingModel);
        return this;
    }

    @Override
    public WirelessParameters copy() {
        WirelessParameters copy = new WirelessParameters();
        copy.frequencyMhz = frequencyMhz;
        copy.bandwidthMhz = bandwidthMhz;
        copy.txPowerDbm = txPowerDbm;
        copy.rxSensitivityDbm = rxSensitivityDbm;
        copy.antennaGainDbi = antennaGainDbi;
        copy.propagationModel = propagationModel;
        copy.pathLossExponent = pathLossExponent;
        copy.fadingEnabled = fadingEnabled;
        copy.fadingModel = fadingModel;
        return copy;
    }
}
