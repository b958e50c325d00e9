/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.gridcomm.network.grid;

import java.util.Objects;

/**
 * Satellite hop parameters. Defaults describe a geostationary hop, {@link #leo()} a low earth orbit one.
 */
public class SatelliteParameters implements PhysicalParameters {

    public static final String ORBIT_TYPE_DEFAULT_VALUE = "GEO";
    public static final double ALTITUDE_KM_DEFAULT_VALUE = 35786;
    public static final double ONE_WAY_DELAY_MS_DEFAULT_VALUE = 270;
    public static final double LEO_ALTITUDE_KM = 550;
    public static final double LEO_ONE_WAY_DELAY_MS = 20;

    private String orbitType = ORBIT_TYPE_DEFAULT_VALUE;
    private double altitudeKm = ALTITUDE_KM_DEFAULT_VALUE;
    private double eirpDbw = 50;
    private double gainToNoiseTemperatureDbK = 25;
    private double oneWayDelayMs = ONE_WAY_DELAY_MS_DEFAULT_VALUE;
    private double rainAttenuationMarginDb = 3;
    private double availabilityPercent = 99.5;

    public static SatelliteParameters leo() {
        return new SatelliteParameters()
                .setOrbitType("LEO")
                .setAltitudeKm(LEO_ALTITUDE_KM)
                .setOneWayDelayMs(LEO_ONE_WAY_DELAY_MS);
    }

    public String getOrbitType() {
        return orbitType;
    }

    public SatelliteParameters setOrbitType(String orbitType) {
        this.orbitType = Objects.requireNonNull(orbitType);
        return this;
    }

    public double getAltitudeKm() {
        return altitudeKm;
    }

    public SatelliteParameters setAltitudeKm(double altitudeKm) {
        this.altitudeKm = altitudeKm;
        return this;
    }

    public double getEirpDbw() {
        return eirpDbw;
    }

    public SatelliteParameters setEirpDbw(double eirpDbw) {
        this.eirpDbw = eirpDbw;
        return this;
    }

    public double getGainToNoiseTemperatureDbK() {
        return gainToNoiseTemperatureDbK;
    }

    public SatelliteParameters setGainToNoiseTemperatureDbK(double gainToNoiseTemperatureDbK) {
        this.gainToNoiseTemperatureDbK = gainToNoiseTemperatureDbK;
        return this;
    }

    public double getOneWayDelayMs() {
        return oneWayDelayMs;
    }

    public SatelliteParameters setOneWayDelayMs(double oneWayDelayMs) {
        this.oneWayDelayMs = oneWayDelayMs;
        return this;
    }

    /**
     * Delay of the full ground-satellite-ground path, which is the delay given to the simulated channel.
     */
    public double getRoundTripDelayMs() {
        return oneWayDelayMs * 2;
    }

    public double getRainAttenuationMarginDb() {
        return rainAttenuationMarginDb;
    }

    public SatelliteParameters setRainAttenuationMarginDb(double rainAttenuationMarginDb) {
        this.rainAttenuationMarginDb = rainAttenuationMarginDb;
        return this;
    }

    public double getAvailabilityPercent() {
        return availabilityPercent;
    }

    public SatelliteParameters setAvailabilityPercent(double availabilityPercent) {
        this.availabilityPercent = availabilityPercent;
        return this;
    }

    @Override
    public SatelliteParameters copy() {
        SatelliteParameters copy = new SatelliteParameters();
        copy.orbitType = orbitType;
        copy.altitudeKm = altitudeKm;
        copy.eirpDbw = eirpDbw;
        copy.gainToNoiseTemperatureDbK = gainToNoiseTemperatureDbK;
        copy.oneWayDelayMs = oneWayDelayMs;
        copy.rainAttenuationMarginDb = rainAttenuationMarginDb;
        copy.availabilityPercent = availabilityPercent;
        return copy;
    }
}
