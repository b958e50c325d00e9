/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import java.util.Objects;

public class CellularParameters implements PhysicalParameters {

    public static final String TECHNOLOGY_DEFAULT_VALUE = "LTE";
    public static final int BAND_DEFAULT_VALUE = 7;
    public static final double ENB_TX_POWER_DBM_DEFAULT_VALUE = 43;
    public static final double UE_TX_POWER_DBM_DEFAULT_VALUE = 23;
    public static final int QCI_DEFAULT_VALUE = 9;

    private String technology = TECHNOLOGY_DEFAULT_VALUE;
    private int band = BAND_DEFAULT_VALUE;
    private double enbTxPowerDbm = ENB_TX_POWER_DBM_DEFAULT_VALUE;
    private double ueTxPowerDbm = UE_TX_POWER_DBM_DEFAULT_VALUE;
    private int qci = QCI_DEFAULT_VALUE;
    private int gbrKbps = 0;
    private int mbrKbps = 0;
    private boolean handoverEnabled = false;

    public String getTechnology() {
        return technology;
    }

    public CellularParameters setTechnology(String technology) {
        this.technology = Objects.requireNonNull(technology);
        return this;
    }

    public int getBand() {
        return band;
    }

    public CellularParameters setBand(int band) {
        this.band = band;
        return this;
    }

    public double getEnbTxPowerDbm() {
        return enbTxPowerDbm;
    }

    public CellularParameters setEnbTxPowerDbm(double enbTxPowerDbm) {
        this.enbTxPowerDbm = enbTxPowerDbm;
        return this;
    }

    public double getUeTxPowerDbm() {
        return ueTxPowerDbm;
    }

    public CellularParameters setUeTxPowerDbm(double ueTxPowerDbm) {
        this.ueTxPowerDbm = ueTxPowerDbm;
        return this;
    }

    public int getQci() {
        return qci;
    }

    public CellularParameters setQci(int qci) {
        this.qci = qci;
        return this;
    }

    public int getGbrKbps() {
        return gbrKbps;
    }

    public CellularParameters setGbrKbps(int gbrKbps) {
        this.gbrKbps = gbrKbps;
        return this;
    }

    public int getMbrKbps() {
        return mbrKbps;
    }

    public CellularParameters setMbrKbps(int mbrKbps) {
        this.mbrKbps = mbrKbps;
        return this;
    }

    public boolean isHandoverEnabled() {
        return handoverEnabled;
    }

    public CellularParameters setHandoverEnabled(boolean handoverEnabled) {
        this.handoverEnabled = handoverEnabled;
        return this;
    }

    @Override
    public CellularParameters copy() {
        CellularParameters copy = new CellularParameters();
        copy.technology = technology;
        copy.band = band;
        copy.enbTxPowerDbm = enbTxPowerDbm;
        copy.ueTxPowerDbm = ueTxPowerDbm;
        copy.qci = qci;
        copy.gbrKbps = gbrKbps;
        copy.mbrKbps = mbrKbps;
        copy.handoverEnabled = handoverEnabled;
        return copy;
    }
}
